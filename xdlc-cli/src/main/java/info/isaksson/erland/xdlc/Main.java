package info.isaksson.erland.xdlc;

import info.isaksson.erland.xdlc.ast.XdlException;
import info.isaksson.erland.xdlc.core.XdlCompileOptions;
import info.isaksson.erland.xdlc.core.XdlCompileResult;
import info.isaksson.erland.xdlc.core.XdlCompilerService;
import info.isaksson.erland.xdlc.emitter.EmitterOptions;
import info.isaksson.erland.xdlc.emitter.EmitterWarning;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * CLI entrypoint: compiles one {@code .xdl} file into {@code <stem>.g.h} (and, with a factory name,
 * {@code impls_<stem>.g.h}).
 *
 * <p>Exit codes: 0 success, 1 usage error, 2 compilation or I/O failure.</p>
 */
public final class Main {

    private static final XdlCompilerService SERVICE = new XdlCompilerService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.input == null || parsed.outputDir == null) {
            System.err.println("Error: an input file and an output directory are required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path input = Paths.get(parsed.input).toAbsolutePath().normalize();
        if (Files.isDirectory(input)) {
            System.err.println("Error: input must be a file: " + input);
            return 1;
        }
        final Path outputDir = Paths.get(parsed.outputDir).toAbsolutePath().normalize();

        XdlCompileOptions options = XdlCompileOptions.defaults().withFactoryName(parsed.factoryName);
        if (parsed.writeAst != null) {
            options = options.withAstOutput(Paths.get(parsed.writeAst).toAbsolutePath().normalize());
        }

        final XdlCompileResult res;
        try {
            res = SERVICE.compile(input, outputDir, options);
        } catch (XdlException e) {
            System.err.println("Error: compilation failed.");
            System.err.println(e.getMessage());
            return 2;
        } catch (IOException e) {
            System.err.println("Error: could not write output to: " + outputDir);
            System.err.println(e.getMessage());
            return 2;
        }

        for (EmitterWarning w : res.warnings()) {
            System.err.println("warning: " + w.format());
        }

        System.out.println(
                "xdlc\n" +
                "- Input: " + input + "\n" +
                "- Header: " + res.headerFile + "\n" +
                (res.stubsFile != null ? "- Stubs: " + res.stubsFile + "\n" : "") +
                (res.astFile != null ? "- AST: " + res.astFile + "\n" : "") +
                "- Files loaded: " + res.sources.loadedFiles().size() + "\n" +
                "- Declarations: " + res.rootDeclarationCount() + "\n" +
                "- Versioned types: " + res.abiTypeCount() + "\n" +
                "- Breakpoints: " + res.emission.breakpoints.size() + "\n" +
                "- Warnings: " + res.warnings().size()
        );
        return 0;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String input;
        String outputDir;
        String factoryName;
        String writeAst;
        boolean verbSeen = false;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                if (a.startsWith("--write-ast=")) {
                    out.writeAst = a.substring("--write-ast=".length());
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--write-ast":
                        out.writeAst = requireValue(args, ++i, "--write-ast");
                        break;
                    default:
                        if (a.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // optional leading verb
                        if (!out.verbSeen && out.input == null && a.equals("compile")) {
                            out.verbSeen = true;
                            continue;
                        }
                        if (out.input == null) {
                            out.input = a;
                        } else if (out.outputDir == null) {
                            out.outputDir = a;
                        } else if (out.factoryName == null) {
                            out.factoryName = checkFactoryName(a);
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            if (out.writeAst != null && out.writeAst.isBlank()) {
                throw new IllegalArgumentException("Invalid value for --write-ast: " + out.writeAst);
            }
            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static String checkFactoryName(String name) {
            // throws IllegalArgumentException for anything that is not a C identifier
            return EmitterOptions.defaults().withFactoryName(name).factoryName;
        }

        static void printHelp() {
            System.out.println(
                    "xdlc\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar xdlc.jar [compile] <input.xdl> <output_dir> [factory_name] [options]\n" +
                    "\n" +
                    "Arguments:\n" +
                    "  <input.xdl>            Root XDL file; imports are resolved relative to the importing file\n" +
                    "  <output_dir>           Directory receiving <stem>.g.h (created when missing)\n" +
                    "  [factory_name]         Emit a runtime version dispatcher with this name, plus the\n" +
                    "                         stub implementation header impls_<stem>.g.h\n" +
                    "\n" +
                    "Options:\n" +
                    "  --write-ast <file>     Write the parsed root file as JSON\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/xdlc.jar samples/xdl/demo.xdl out\n" +
                    "  java -jar target/xdlc.jar compile samples/xdl/demo.xdl out CreateDemo --write-ast out/demo.ast.json\n"
            );
        }
    }
}
