package com.github.seamorder;

import com.github.seamorder.atsp.CutStrategy;
import com.github.seamorder.atsp.HamiltonianPathSolver;
import com.github.seamorder.atsp.OjAlgoHamiltonianPathSolver;
import com.github.seamorder.image.ImageReader;
import com.github.seamorder.image.TourWriter;
import org.ojalgo.netio.BasicLogger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Command line entry point: reads images, finds the cheapest left-to-right ordering and writes it out.
 * <pre>
 * Main &lt;input&gt; &lt;output&gt; [-d] [-a] [-t &lt;millis&gt;]
 *   -d  debug logging
 *   -a  cut every subtour of a candidate, not only the one through the depot
 *   -t  timeout in milliseconds (default one hour)
 * </pre>
 */
public class Main {
    private static final String USAGE = "Usage: Main <input> <output> [-d] [-a] [-t <millis>]";

    private Main() {
    }

    /**
     * @param args see class documentation
     * @throws IOException if reading or writing fails
     */
    public static void main(String[] args) throws IOException {
        if (args.length < 2 || args[0].isBlank() || args[1].isBlank()) {
            throw new IllegalArgumentException("Either argument 1 or 2 is empty. " + USAGE);
        }

        var solver = new OjAlgoHamiltonianPathSolver();
        var timeout = 1000L * 60L * 60L;

        for (var i = 2; i < args.length; i++) {
            switch (args[i]) {
                case "-d" -> solver.setDebug(true);
                case "-a" -> solver.setCutStrategy(CutStrategy.ALL_CYCLES);
                case "-t" -> {
                    if (++i == args.length) {
                        throw new IllegalArgumentException("-t requires a value. " + USAGE);
                    }
                    timeout = parseTimeout(args[i]);
                }
                default -> throw new IllegalArgumentException("Unknown option " + args[i] + ". " + USAGE);
            }
        }

        var result = run(Path.of(args[0]), Path.of(args[1]), solver, timeout);

        BasicLogger.debug("Obj value: " + result.objective() + " (" + result.state() + ")");
    }

    /**
     * Read, solve and write.
     *
     * @param input         the image file
     * @param output        the file to write the ordering to
     * @param solver        the solver
     * @param timeoutMillis the maximum wall-clock time in milliseconds
     * @return the solution
     * @throws IOException if reading or writing fails
     */
    public static HamiltonianPathSolver.Result run(Path input,
                                                   Path output,
                                                   HamiltonianPathSolver solver,
                                                   long timeoutMillis) throws IOException {
        var images = ImageReader.read(input);
        var result = solver.solve(images, timeoutMillis);

        TourWriter.write(output, result.order());
        return result;
    }

    private static long parseTimeout(String s) {
        try {
            var timeout = Long.parseLong(s);
            if (timeout <= 0L) {
                throw new IllegalArgumentException("timeout must be positive: " + s);
            }
            return timeout;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("timeout is not a number: " + s, e);
        }
    }
}
