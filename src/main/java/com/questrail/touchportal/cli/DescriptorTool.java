package com.questrail.touchportal.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.touchportal.descriptor.DescriptorFiles;
import com.questrail.touchportal.descriptor.DescriptorGenerator;
import com.questrail.touchportal.descriptor.DescriptorValidationException;
import com.questrail.touchportal.descriptor.DescriptorValidator;
import com.questrail.touchportal.descriptor.PluginDeclaration;
import com.questrail.touchportal.descriptor.ValidationReport;
import com.questrail.touchportal.descriptor.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command line front end for descriptor validation and generation.
 *
 * <pre>
 *   tpsdk validate entry.tp
 *   tpsdk generate plugin.json -o entry.tp --indent 2
 * </pre>
 *
 * Exit codes: {@value #OK} valid, {@value #INVALID} violations found,
 * {@value #IO_ERROR} file could not be read or written.
 */
@Command(
        name = "tpsdk",
        mixinStandardHelpOptions = true,
        description = "Validate or generate plugin descriptor files",
        subcommands = {
                DescriptorTool.ValidateCommand.class,
                DescriptorTool.GenerateCommand.class
        }
)
public final class DescriptorTool implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(DescriptorTool.class);

    static final int OK = 0;
    static final int INVALID = 1;
    static final int IO_ERROR = 2;

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        System.exit(new CommandLine(new DescriptorTool()).execute(args));
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    private static void printViolations(PrintWriter out, ValidationReport report) {
        for (Violation v : report.violations()) {
            out.println(v);
        }
        out.println(report.violations().size() + " problem(s) found");
    }

    @Command(name = "validate", description = "Check a descriptor file against the SDK attribute table")
    static final class ValidateCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "DESCRIPTOR", description = "Descriptor file, e.g. entry.tp")
        Path descriptor;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();

            final String text;
            try {
                text = DescriptorFiles.readText(descriptor);
            } catch (IOException e) {
                log.debug("Cannot read {}", descriptor, e);
                err.println("Cannot read " + descriptor + ": " + e.getMessage());
                return IO_ERROR;
            }

            ValidationReport report = new DescriptorValidator().validate(text);
            if (report.isValid()) {
                out.println(descriptor + ": valid (sdk " + report.sdkVersion() + ")");
                return OK;
            }
            printViolations(out, report);
            return INVALID;
        }
    }

    @Command(name = "generate", description = "Expand a plugin declaration into a descriptor")
    static final class GenerateCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "DECLARATION", description = "Plugin declaration JSON file")
        Path declaration;

        @Option(names = {"-o", "--output"}, description = "Output file; standard output when omitted")
        Path output;

        @Option(names = {"--indent"}, defaultValue = "2", description = "Spaces per level, negative for compact output")
        int indent;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();

            final PluginDeclaration parsed;
            try {
                JsonNode document = DescriptorFiles.read(declaration);
                parsed = PluginDeclaration.fromJson(document);
            } catch (JsonProcessingException e) {
                err.println(declaration + " is not valid JSON: " + e.getOriginalMessage());
                return INVALID;
            } catch (IOException e) {
                log.debug("Cannot read {}", declaration, e);
                err.println("Cannot read " + declaration + ": " + e.getMessage());
                return IO_ERROR;
            } catch (IllegalArgumentException e) {
                err.println(declaration + ": " + e.getMessage());
                return INVALID;
            }

            final ObjectNode descriptor;
            try {
                descriptor = new DescriptorGenerator().generate(parsed);
            } catch (DescriptorValidationException e) {
                printViolations(out, e.report());
                return INVALID;
            }

            if (output == null) {
                out.println(DescriptorFiles.toJson(descriptor, indent));
                return OK;
            }
            try {
                DescriptorFiles.write(output, descriptor, indent);
            } catch (IOException e) {
                log.debug("Cannot write {}", output, e);
                err.println("Cannot write " + output + ": " + e.getMessage());
                return IO_ERROR;
            }
            out.println("Wrote " + output);
            return OK;
        }
    }
}
