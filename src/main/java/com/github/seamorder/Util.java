package com.github.seamorder;

import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.type.CalendarDateDuration;
import org.ojalgo.type.context.NumberContext;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static org.ojalgo.type.CalendarDateUnit.MILLIS;

/**
 * Miscellaneous utilities.
 */
public class Util {
    private Util() {
    }

    /**
     * Helper to build a new {@link ExpressionsBasedModel} for ojAlgo. This currently has a default set
     * of options to control rounding, timeouts, and use the dual simplex solver by default.
     *
     * @param deadline this will be converted to a timeout
     * @return the built model
     */
    public static ExpressionsBasedModel newModel(long deadline) {
        var options = setTimeout(deadline, new Optimisation.Options());
        options.solution = NumberContext.of(14, 9);

        // much faster than the primal solver once cuts start piling up
        options.linear().dual();
        return new ExpressionsBasedModel(options);
    }

    /**
     * Helper to set a timeout on an {@link Optimisation.Options} object.
     *
     * @param deadline the deadline time, which will be converted to a timeout.
     * @param opts     the options to be updated.
     * @return the same {@link Optimisation.Options} that was passed in.
     */
    public static Optimisation.Options setTimeout(long deadline, Optimisation.Options opts) {
        var duration = new CalendarDateDuration(Math.max(0L, deadline - System.currentTimeMillis()), MILLIS);
        return opts.abort(duration).suffice(duration);
    }

    /**
     * Refresh the timeout and minimise.
     *
     * @param model    the model
     * @param deadline the deadline time, which will be converted to a timeout.
     * @return the result
     */
    public static Optimisation.Result minimize(ExpressionsBasedModel model, long deadline) {
        setTimeout(deadline, model.options);
        return model.minimise();
    }

    /**
     * Format milliseconds as seconds, for log output.
     *
     * @param millis a duration
     * @return the same duration in seconds, with three decimals
     */
    public static BigDecimal toSeconds(long millis) {
        return BigDecimal.valueOf(millis).divide(BigDecimal.valueOf(1000L), 3, RoundingMode.HALF_EVEN);
    }
}
