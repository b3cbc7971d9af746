package main;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

import analysis.flow.AnnotationCollector;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

public final class FlowCheckOptions {

    /**
     * Files to check, standard input if empty
     */
    @Parameter(description = "Source files to check (standard input is read if none are given)")
    private List<String> files = new ArrayList<>();

    /**
     * Flag for printing useage information
     */
    @Parameter(names = { "-h", "-help", "-useage", "--help" }, description = "Print useage information")
    private boolean help = false;

    /**
     * Level of output
     */
    @Parameter(
        names = { "-output", "-o" },
        validateWith = FlowCheckOptions.NonNegativeValidator.class,
        description = "Level of output (higher means more console output). At 1 malformed declarations and constructs that are not analyzed are reported, at 2 the sources and declared states are printed as well.")
    private Integer outputLevel = 0;

    /**
     * Character encoding of the source files
     */
    @Parameter(
        names = { "-encoding", "-e" },
        validateWith = FlowCheckOptions.EncodingValidator.class,
        description = "Character encoding of the source files.")
    private String encoding = "UTF-8";

    /**
     * File to write the report to
     */
    @Parameter(names = { "-out" }, description = "File to write the report to, default is standard out.")
    private String outputFile;

    /**
     * Flag for writing the report as JSON
     */
    @Parameter(names = { "-json" }, description = "If set, write the report as a JSON array with one object per source")
    private boolean json = false;

    /**
     * Lines of source printed around each violation
     */
    @Parameter(
        names = { "-context" },
        validateWith = FlowCheckOptions.NonNegativeValidator.class,
        description = "Number of source lines to print before and after each violation.")
    private Integer context = 0;

    /**
     * Word introducing an annotation comment
     */
    @Parameter(names = { "-marker" }, description = "Word that introduces a label annotation in a comment.")
    private String marker = AnnotationCollector.DEFAULT_MARKER;

    /**
     * Number of threads to use when checking several files
     */
    @Parameter(
        names = { "-numThreads" },
        validateWith = FlowCheckOptions.PositiveValidator.class,
        description = "Number of sources checked concurrently, default is the number of available processors.")
    private Integer numThreads = Runtime.getRuntime().availableProcessors();

    /**
     * Validate an integer option that must not be negative
     */
    public static class NonNegativeValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            if (parseInt(name, value) < 0) {
                throw new ParameterException("Parameter " + name + " must not be negative (found " + value + ")");
            }
        }
    }

    /**
     * Validate an integer option that must be at least 1
     */
    public static class PositiveValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            if (parseInt(name, value) < 1) {
                throw new ParameterException("Parameter " + name + " must be positive (found " + value + ")");
            }
        }
    }

    /**
     * Validate the requested character encoding
     */
    public static class EncodingValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            boolean supported;
            try {
                supported = Charset.isSupported(value);
            }
            catch (IllegalArgumentException e) {
                supported = false;
            }
            if (!supported) {
                throw new ParameterException("Unsupported encoding for " + name + ": " + value);
            }
        }
    }

    static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException e) {
            throw new ParameterException("Parameter " + name + " should be an integer (found " + value + ")");
        }
    }

    private FlowCheckOptions() {
        // Do not instantiate
    }

    /**
     * Parse the options for the given args
     *
     * @param args arguments to parse
     * @return Options object with the parsed options available via getters
     */
    public static FlowCheckOptions getOptions(String[] args) {
        FlowCheckOptions o = new FlowCheckOptions();
        JCommander jc = new JCommander();
        jc.addObject(o);
        jc.parse(args);
        return o;
    }

    /**
     * Should we print the useage information
     *
     * @return true if we should print useage
     */
    public boolean shouldPrintUseage() {
        return help;
    }

    public static String getUseage() {
        StringBuilder sb = new StringBuilder();
        FlowCheckOptions o = new FlowCheckOptions();
        JCommander jc = new JCommander(o);
        jc.setProgramName("flowcheck");
        jc.getUsageFormatter().usage(sb);
        sb.append("\nExit status is 0 if no violations are found, 1 if some are and 2 on error.\n");
        return sb.toString();
    }

    /**
     * Files to check
     *
     * @return file names in the order given, empty if standard input should be read
     */
    public List<String> getFiles() {
        return files;
    }

    public Integer getOutputLevel() {
        return outputLevel;
    }

    public String getEncoding() {
        return encoding;
    }

    public Charset getCharset() {
        return Charset.forName(encoding);
    }

    /**
     * Get the file to write the report to
     *
     * @return file name or null if the report goes to standard out
     */
    public String getOutputFile() {
        return outputFile;
    }

    public boolean shouldWriteJSON() {
        return json;
    }

    public Integer getContext() {
        return context;
    }

    public String getMarker() {
        return marker;
    }

    public Integer getNumThreads() {
        return numThreads;
    }
}
