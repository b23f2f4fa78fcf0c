package bytebeat.cli;

import bytebeat.ast.Program;
import bytebeat.lexer.LexerException;
import bytebeat.parser.ParseException;
import bytebeat.print.PrintStyle;
import bytebeat.sema.TypeError;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class Main {
    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private static final String USAGE_LINE = "Usage: bytebeat [--simplify] [--minimal] (-e <source> | <file>)";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        boolean simplify = false;
        PrintStyle style = PrintStyle.PRETTY;
        String source = null;
        Path input = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--simplify" -> simplify = true;
                case "--minimal" -> style = PrintStyle.MINIMAL;
                case "-e" -> {
                    if (i + 1 >= args.length) return usage(err, "-e needs a source argument");
                    source = args[++i];
                }
                default -> {
                    if (arg.startsWith("-")) return usage(err, "Unknown option: " + arg);
                    if (input != null) return usage(err, "More than one input file");
                    input = Path.of(arg);
                }
            }
        }
        if ((source == null) == (input == null)) return usage(err, "Give exactly one of -e <source> or <file>");

        if (input != null) {
            try {
                source = Files.readString(input);
            } catch (IOException e) {
                err.println("Cannot read " + input + ": " + e.getMessage());
                return USAGE;
            }
        }

        Program program;
        try {
            program = Program.parse(source);
        } catch (LexerException e) {
            err.println("lex error: " + e.getMessage());
            return FAILED;
        } catch (ParseException e) {
            err.println("parse error: " + e.getMessage());
            return FAILED;
        }

        for (TypeError error : program.typeErrors()) {
            err.println("type error: " + error);
        }
        program.ubInfo().ifPresent(ub -> err.println("undefined behavior: " + ub));

        if (simplify) program = program.simplify();
        out.println(program.toString(style));
        return OK;
    }

    private static int usage(PrintStream err, String problem) {
        err.println(problem);
        err.println(USAGE_LINE);
        return USAGE;
    }
}
