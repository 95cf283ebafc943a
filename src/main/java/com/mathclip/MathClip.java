package com.mathclip;

import com.mathclip.output.OutputFormat;
import com.mathclip.output.ResultFormatter;
import com.mathclip.parser.Diagnostic;
import com.mathclip.render.PlainTextRenderer;
import com.mathclip.table.CommandTable;
import com.mathclip.table.CommandTableException;
import com.mathclip.table.CommandTableLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

@Command(name = "mathclip", mixinStandardHelpOptions = true, version = "1.0",
         description = "Convert LaTeX math markup to plain text and MathML")
public class MathClip implements Callable<Integer> {
    @Parameters(index = "0", arity = "0..1", description = "The markup to convert (default: stdin)")
    private String markup;

    @Option(names = {"-f", "--format"},
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private OutputFormat format = OutputFormat.BOTH;

    @Option(names = {"-s", "--statement-separator"},
            description = "Separator between aligned statements in plain text; \\n is a newline")
    private String statementSeparator = PlainTextRenderer.DEFAULT_STATEMENT_SEPARATOR;

    @Option(names = {"-t", "--commands"}, description = "JSON command table merged over the built-in one")
    private File commandsFile;

    @Option(names = {"-c", "--compact-output"}, description = "Compact JSON output")
    private boolean compactOutput = false;

    @Option(names = {"-v", "--verbose"}, description = "Print diagnostics to stderr")
    private boolean verbose = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MathClip())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        try {
            String input = markup != null ? markup : new String(System.in.readAllBytes(), StandardCharsets.UTF_8);

            MathConverter converter = new MathConverter(loadTable(), unescape(statementSeparator));
            ConversionResult result = converter.convert(input);

            if (verbose) {
                for (Diagnostic diagnostic : result.diagnostics()) {
                    System.err.println("warning: " + diagnostic);
                }
            }

            ResultFormatter formatter = new ResultFormatter(format, !compactOutput);
            out.println(formatter.format(result));
            return 0;
        } catch (ConversionException | IOException | CommandTableException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private CommandTable loadTable() throws IOException {
        CommandTable table = CommandTable.builtIn();
        if (commandsFile == null) {
            return table;
        }
        try (InputStream input = new FileInputStream(commandsFile)) {
            return table.mergedWith(new CommandTableLoader().load(input));
        }
    }

    static String unescape(String separator) {
        return separator.replace("\\n", "\n").replace("\\t", "\t");
    }
}
