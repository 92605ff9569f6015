package eu.nurkert.depSync.update;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

/**
 * Ordered {@link UpdateStep UpdateSteps} executed for one dependency.
 */
public class UpdateJob {

    private final List<UpdateStep> steps = new ArrayList<>();

    public UpdateJob addStep(UpdateStep step) {
        steps.add(step);
        return this;
    }

    public void run(UpdateContext context) throws Exception {
        for (UpdateStep step : steps) {
            if (context.isCancelled()) {
                context.log(Level.FINE, "Skipping remaining steps for {0}: {1}",
                        context.getDependency().getName(), context.getCancelReason().orElse("cancelled"));
                break;
            }
            step.execute(context);
        }
    }
}
