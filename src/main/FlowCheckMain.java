package main;

import java.io.BufferedWriter;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import lang.ParseException;

import org.json.JSONArray;
import org.json.JSONException;

import results.CollectedResults;
import util.Logger;
import util.OrderedPair;
import util.print.PrettyPrinter;
import analysis.flow.FlowAnalysis;

import com.beust.jcommander.ParameterException;

/**
 * Check source files for information flow violations, see usage
 */
public class FlowCheckMain {

    /**
     * No violations were found in any source
     */
    public static final int STATUS_OK = 0;
    /**
     * Every source was checked and at least one violation was found
     */
    public static final int STATUS_VIOLATIONS = 1;
    /**
     * A source could not be read or parsed, or the options were invalid
     */
    public static final int STATUS_ERROR = 2;

    /**
     * Name used for a source read from standard input
     */
    static final String STDIN_NAME = "<stdin>";

    /**
     * Check the sources given on the command line
     *
     * @param args options and parameters see useage (pass in "-h") for details
     */
    public static void main(String[] args) {
        FlowCheckOptions options;
        try {
            options = FlowCheckOptions.getOptions(args);
        }
        catch (ParameterException e) {
            System.err.println(e.getMessage());
            System.err.println(FlowCheckOptions.getUseage());
            System.exit(STATUS_ERROR);
            return;
        }
        if (options.shouldPrintUseage()) {
            System.err.println(FlowCheckOptions.getUseage());
            return;
        }
        System.exit(run(options, System.in));
    }

    /**
     * Read, check and report every source
     *
     * @param options parsed options
     * @param stdin stream read when no file is given
     * @return exit status
     */
    public static int run(FlowCheckOptions options, InputStream stdin) {
        Logger.setOutputLevel(options.getOutputLevel());

        List<OrderedPair<String, String>> sources = new ArrayList<>();
        boolean error = false;
        if (options.getFiles().isEmpty()) {
            try {
                sources.add(new OrderedPair<>(STDIN_NAME, read(stdin, options.getCharset())));
            }
            catch (IOException e) {
                System.err.println(STDIN_NAME + ": could not read: " + e.getMessage());
                return STATUS_ERROR;
            }
        }
        for (String file : options.getFiles()) {
            try {
                String text = new String(Files.readAllBytes(Paths.get(file)), options.getCharset());
                sources.add(new OrderedPair<>(file, text));
            }
            catch (IOException e) {
                System.err.println(file + ": could not read: " + e);
                error = true;
            }
        }

        List<CollectedResults> results = new ArrayList<>();
        error |= !check(sources, options, results);

        try {
            report(results, options);
        }
        catch (IOException | JSONException e) {
            System.err.println("Could not write the report: " + e.getMessage());
            return STATUS_ERROR;
        }

        if (error) {
            return STATUS_ERROR;
        }
        for (CollectedResults r : results) {
            if (r.hasViolations()) {
                return STATUS_VIOLATIONS;
            }
        }
        return STATUS_OK;
    }

    /**
     * Analyze the sources concurrently. Results are added in the order of the sources, sources with a syntax error are
     * reported on standard error and skipped.
     *
     * @param sources pairs of source name and text
     * @param options parsed options
     * @param results list to add the results to
     * @return true if every source was analyzed
     */
    static boolean check(List<OrderedPair<String, String>> sources, FlowCheckOptions options,
                         List<CollectedResults> results) {
        if (sources.isEmpty()) {
            return true;
        }
        final FlowAnalysis analysis = new FlowAnalysis(options.getMarker());
        int numThreads = Math.min(options.getNumThreads(), sources.size());
        ExecutorService exec = Executors.newFixedThreadPool(numThreads);
        List<Future<CollectedResults>> futures = new ArrayList<>();
        for (final OrderedPair<String, String> source : sources) {
            futures.add(exec.submit(new Callable<CollectedResults>() {

                @Override
                public CollectedResults call() throws ParseException {
                    Logger.println(1, "Checking " + source.fst());
                    return analysis.analyze(source.fst(), source.snd());
                }
            }));
        }

        boolean ok = true;
        try {
            for (int i = 0; i < futures.size(); i++) {
                String name = sources.get(i).fst();
                try {
                    results.add(futures.get(i).get());
                }
                catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof ParseException) {
                        ParseException pe = (ParseException) cause;
                        System.err.println(name + ":" + pe.getLine() + ": " + pe.getMessage());
                    }
                    else {
                        System.err.println(name + ": analysis failed: " + cause);
                        if (Logger.getOutputLevel() >= 1) {
                            cause.printStackTrace();
                        }
                    }
                    ok = false;
                }
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for the analysis", e);
        }
        finally {
            exec.shutdownNow();
        }
        return ok;
    }

    /**
     * Write the report for all analyzed sources to the output file, or standard out if there is none
     */
    private static void report(List<CollectedResults> results, FlowCheckOptions options) throws IOException,
                                                                                           JSONException {
        if (Logger.getOutputLevel() >= 2) {
            for (CollectedResults r : results) {
                System.err.println("Source " + r.getName() + ":\n" + r.getSource());
                System.err.println(PrettyPrinter.statesString(r.getScopes()));
            }
        }

        String outputFile = options.getOutputFile();
        Writer out;
        if (outputFile == null) {
            out = new BufferedWriter(new OutputStreamWriter(System.out, options.getCharset()));
        }
        else {
            out = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(outputFile), options.getCharset()));
        }
        try {
            writeReport(results, options, out);
        }
        finally {
            if (outputFile == null) {
                out.flush();
            }
            else {
                out.close();
            }
        }
    }

    /**
     * Write the report, either text or a JSON array with one object per source
     *
     * @param results results to report
     * @param options parsed options
     * @param out writer to write to
     * @throws IOException writer issues
     * @throws JSONException issues writing JSON
     */
    static void writeReport(List<CollectedResults> results, FlowCheckOptions options, Writer out) throws IOException,
                                                                                                 JSONException {
        if (options.shouldWriteJSON()) {
            JSONArray array = new JSONArray();
            for (CollectedResults r : results) {
                array.put(r.toJSON());
            }
            out.write(array.toString(2));
            out.write("\n");
            return;
        }
        for (CollectedResults r : results) {
            out.write(PrettyPrinter.resultsString(r, options.getContext()));
            out.write("\n");
        }
    }

    private static String read(InputStream in, Charset charset) throws IOException {
        StringBuilder sb = new StringBuilder();
        Reader reader = new InputStreamReader(in, charset);
        char[] buf = new char[4096];
        int n;
        while ((n = reader.read(buf)) != -1) {
            sb.append(buf, 0, n);
        }
        return sb.toString();
    }
}
