package scriptdetectcli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine.*;
import scriptdetect.Script;
import scriptdetect.ScriptDetector;
import scriptdetect.ScriptPredicates;

import java.io.*;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.logging.*;

/**
 * Subcommand for detecting the writing system of plain text.
 */
@Command(name = "detect", description = "\033[1;34mDetect the writing system (script) of a text\033[0m", mixinStandardHelpOptions = true)
public class DetectCommand implements Callable<Integer> {
    static final int EXIT_DETECTED = 0;
    static final int EXIT_NO_SCRIPT = 1;
    static final int EXIT_IO_ERROR = 3;

    @Option(names = "--list-scripts", description = "List all supported scripts with their binding codes")
    private boolean listScripts;

    @Option(names = {"-i", "--input"}, paramLabel = "<file>", description = "Input file")
    private File input;

    @Option(names = {"--in-enc"}, paramLabel = "<encoding>", defaultValue = "UTF-8", description = "Input encoding")
    private String inEncoding;

    @Option(names = "--json", description = "Print the result as a JSON object")
    private boolean json;

    @Option(names = {"-v", "--verbose"}, description = "Enable detector logging")
    private boolean verbose;

    @Parameters(paramLabel = "<text>", arity = "0..*", description = "Text to inspect (read from stdin when omitted)")
    private List<String> words;

    @Spec
    private Model.CommandSpec spec;

    private static final Logger LOGGER = Logger.getLogger(DetectCommand.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        if (listScripts) {
            out.println("Supported scripts (in detection order):");
            for (Script s : ScriptPredicates.tableOrder()) {
                out.printf("  %-12s %2d%n", s.getName(), s.code());
            }
            out.flush();
            return EXIT_DETECTED;
        }

        if (input != null && words != null && !words.isEmpty()) {
            throw new ParameterException(spec.commandLine(),
                    "Specify either --input or <text>, not both");
        }

        if (verbose) {
            ScriptDetector.setVerboseLogging(true);
        }

        String text;
        try {
            text = readText();
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Error reading input", e);
            spec.commandLine().getErr().println("❌ Cannot read input: " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        Optional<Script> script = ScriptDetector.detectScript(text);

        if (json) {
            out.println(toJson(script.orElse(null)));
        } else {
            out.println(script.map(Script::getName).orElse("Undetermined"));
        }
        out.flush();
        return script.isPresent() ? EXIT_DETECTED : EXIT_NO_SCRIPT;
    }

    private String readText() throws IOException {
        // Charset.forName throws IllegalArgumentException subclasses for bad names
        Charset charset = Charset.forName(inEncoding);
        if (input != null) {
            return Files.readString(input.toPath(), charset);
        }
        if (words != null && !words.isEmpty()) {
            return String.join(" ", words);
        }
        // Strict decoding, so stdin fails like Files.readString on malformed bytes
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(System.in.readAllBytes()))
                .toString();
    }

    static String toJson(Script script) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("script", script == null ? null : script.getName());
        node.put("code", script == null ? null : script.code());
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
