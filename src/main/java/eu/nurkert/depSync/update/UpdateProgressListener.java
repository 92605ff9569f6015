package eu.nurkert.depSync.update;

/**
 * Callback interface that allows components to follow each dependency check while a
 * run is in progress. Methods are invoked from worker threads.
 */
public interface UpdateProgressListener {

    UpdateProgressListener NONE = new UpdateProgressListener() {
    };

    default void onCheckStarted(DependencyDescriptor dependency, String currentVersion) {
    }

    default void onCheckCompleted(DependencyDescriptor dependency, UpdateResult result) {
    }
}
