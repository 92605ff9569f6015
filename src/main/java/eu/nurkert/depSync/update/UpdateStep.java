package eu.nurkert.depSync.update;

/**
 * One stage of the check performed for a single dependency inside an {@link UpdateJob}.
 * A step may stop the remaining stages by calling {@link UpdateContext#cancel(String)}.
 */
@FunctionalInterface
public interface UpdateStep {

    /**
     * @param context state shared between the steps of one job
     * @throws Exception if the step fails; the job reports it as the dependency's error
     */
    void execute(UpdateContext context) throws Exception;
}
