package org.prossme.bpmn.autolayout;

import lombok.extern.slf4j.Slf4j;
import org.prossme.bpmn.autolayout.bpmn.BpmnValidator;
import org.prossme.bpmn.autolayout.config.LayoutConfig;
import org.prossme.bpmn.autolayout.config.LayoutConfigHelper;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Command line driver:
 * <pre>
 * Main &lt;input.bpmn|input.json&gt; [output.bpmn] [--config layout.json]
 * </pre>
 */
@Slf4j
public class Main {
    // ------ Paths given on the command line
    private String inputPath;
    private String outputPath;
    private String configPath;

    // ------- Loaded and produced content
    private LayoutConfig config;
    private String input;
    private String output;

    public static void main(String[] args) throws Exception {
        Main main = new Main();
        if (!main.parseArguments(args)) {
            log.error("Usage: Main <input.bpmn|input.json> [output.bpmn] [--config layout.json]");
            System.exit(2);
        }
        main.run();
    }

    boolean parseArguments(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg)) {
                if (i + 1 >= args.length) {
                    return false;
                }
                configPath = args[++i];
            } else if (inputPath == null) {
                inputPath = arg;
            } else if (outputPath == null) {
                outputPath = arg;
            } else {
                return false;
            }
        }
        return inputPath != null;
    }

    public void run() throws Exception {
        loadConfig();
        readInput();
        layout();
        validateOutput();
        writeOutput();
    }

    private void loadConfig() throws Exception {
        config = configPath == null
                ? LayoutConfigHelper.loadDefault()
                : LayoutConfigHelper.loadConfigFile(configPath);
    }

    private void readInput() throws Exception {
        input = Files.readString(Paths.get(inputPath), StandardCharsets.UTF_8);
    }

    private void layout() {
        BpmnAutoLayout autoLayout = new BpmnAutoLayout(config);
        output = inputPath.toLowerCase(Locale.ROOT).endsWith(".json")
                ? autoLayout.addDiagramFromJson(input)
                : autoLayout.addDiagram(input);
    }

    private void validateOutput() {
        BpmnValidator.validate(output);
        log.info("Output passed BPMN schema validation");
    }

    private void writeOutput() throws Exception {
        if (outputPath == null) {
            log.info("Laid out {} ({} chars), no output path given", inputPath, output.length());
            return;
        }
        Path target = Paths.get(outputPath);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, output, StandardCharsets.UTF_8);
        log.info("Wrote {}", target);
    }

    String getOutput() {
        return output;
    }
}
