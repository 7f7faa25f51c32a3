package com.specharvest.core.output.impl;

import com.specharvest.core.output.OutputBundle;
import com.specharvest.core.output.OutputContext;
import com.specharvest.core.output.OutputFile;
import com.specharvest.core.output.OutputWriter;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Prints rendered files to a stream, by default standard output.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colors for headers ("true"/"false", default: "false")</li>
 *   <li>{@code console.showHeaders} - print a header before each file ("true"/"false", default: "true")</li>
 * </ul>
 *
 * <p>Headers are skipped for a single file so piped output stays machine-readable.
 */
public class ConsoleWriter implements OutputWriter {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_CYAN = "\u001B[1;36m";

    private final PrintStream out;

    public ConsoleWriter() {
        this(System.out);
    }

    /**
     * Creates a writer printing to the given stream.
     *
     * @param out target stream
     */
    public ConsoleWriter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void write(OutputBundle bundle, OutputContext context) {
        boolean colors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "false"));
        boolean headers = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "true"));

        List<OutputFile> files = bundle.files();
        boolean printHeaders = headers && files.size() > 1;
        for (int i = 0; i < files.size(); i++) {
            OutputFile file = files.get(i);
            if (printHeaders) {
                String header = "==> " + file.relativePath() + " (" + (i + 1) + "/" + files.size() + ")";
                out.println(colors ? ANSI_BOLD_CYAN + header + ANSI_RESET : header);
            }
            out.print(file.content());
            if (!file.content().endsWith("\n")) {
                out.println();
            }
        }
        out.flush();
    }
}
