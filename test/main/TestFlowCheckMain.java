package main;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import junit.framework.TestCase;

import org.json.JSONArray;
import org.junit.Test;

public class TestFlowCheckMain extends TestCase {

    private static InputStream input(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    private static File write(String prefix, String contents) throws IOException {
        File f = File.createTempFile(prefix, ".py");
        f.deleteOnExit();
        Files.write(f.toPath(), contents.getBytes(StandardCharsets.UTF_8));
        return f;
    }

    @Test
    public void testStdinJSON() throws IOException {
        File out = File.createTempFile("report", ".json");
        out.deleteOnExit();
        FlowCheckOptions o = FlowCheckOptions.getOptions(new String[] { "-json", "-out", out.getPath() });
        int status = FlowCheckMain.run(o, input("# fp a: high.\nb = a\n"));
        assertEquals(FlowCheckMain.STATUS_VIOLATIONS, status);

        JSONArray report = new JSONArray(new String(Files.readAllBytes(out.toPath()), StandardCharsets.UTF_8));
        assertEquals(1, report.length());
        assertEquals(FlowCheckMain.STDIN_NAME, report.getJSONObject(0).getString("source"));
        assertEquals(1, report.getJSONObject(0).getInt("explicit"));
    }

    @Test
    public void testFilesInOrder() throws IOException {
        File clean = write("clean", "x = 1\n");
        File leaky = write("leaky", "# fp s: high.\nif s:\n    y = 1\n");
        File out = File.createTempFile("report", ".json");
        out.deleteOnExit();
        String[] args = { "-json", "-numThreads", "2", "-out", out.getPath(), leaky.getPath(), clean.getPath() };
        int status = FlowCheckMain.run(FlowCheckOptions.getOptions(args), input(""));
        assertEquals(FlowCheckMain.STATUS_VIOLATIONS, status);

        JSONArray report = new JSONArray(new String(Files.readAllBytes(out.toPath()), StandardCharsets.UTF_8));
        assertEquals(2, report.length());
        assertEquals(leaky.getPath(), report.getJSONObject(0).getString("source"));
        assertEquals(1, report.getJSONObject(0).getInt("implicit"));
        assertEquals(clean.getPath(), report.getJSONObject(1).getString("source"));
        assertEquals(0, report.getJSONObject(1).getJSONArray("violations").length());
    }

    @Test
    public void testNoViolations() throws IOException {
        File out = File.createTempFile("report", ".txt");
        out.deleteOnExit();
        FlowCheckOptions o = FlowCheckOptions.getOptions(new String[] { "-out", out.getPath() });
        assertEquals(FlowCheckMain.STATUS_OK, FlowCheckMain.run(o, input("x = 1\n")));
        String text = new String(Files.readAllBytes(out.toPath()), StandardCharsets.UTF_8);
        assertTrue(text, text.contains("No flow violations detected!"));
    }

    @Test
    public void testErrors() throws IOException {
        File out = File.createTempFile("report", ".txt");
        out.deleteOnExit();
        File broken = write("broken", "def :\n");
        File clean = write("clean", "x = 1\n");
        String[] args = { "-out", out.getPath(), broken.getPath(), clean.getPath() };
        assertEquals(FlowCheckMain.STATUS_ERROR, FlowCheckMain.run(FlowCheckOptions.getOptions(args), input("")));
        String text = new String(Files.readAllBytes(out.toPath()), StandardCharsets.UTF_8);
        // the other file is still checked
        assertTrue(text, text.contains(clean.getPath()));

        String[] missing = { "-out", out.getPath(), new File(clean.getParentFile(), "no_such_file.py").getPath() };
        assertEquals(FlowCheckMain.STATUS_ERROR, FlowCheckMain.run(FlowCheckOptions.getOptions(missing), input("")));
    }
}
