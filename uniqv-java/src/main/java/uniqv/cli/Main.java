package uniqv.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uniqv.ast.Program;
import uniqv.lexer.Lexer;
import uniqv.lexer.LexerException;
import uniqv.lexer.Token;
import uniqv.parser.ParseException;
import uniqv.parser.Parser;
import uniqv.print.AstPrinter;
import uniqv.rename.VariableRenamer;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private Main() {}

    public static void main(String[] args) throws IOException {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Renames the locals of every callable in {@code args[0]} and writes the result
     * to {@code args[1]}, or to {@code out} when no output path is given.
     */
    static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
        if (args.length < 1 || args.length > 2) {
            err.println("Usage: uniqv <input.uqv> [output.uqv]");
            return USAGE;
        }

        Path input = Path.of(args[0]);
        if (!Files.isRegularFile(input)) {
            err.println("No such file: " + input);
            return USAGE;
        }

        String source = Files.readString(input);
        log.info("[1/4] Reading: {}", input);

        String renamed;
        try {
            List<Token> tokens = new Lexer(source).tokenize();
            log.info("[2/4] Lexer: {} tokens", tokens.size());

            Program program = new Parser(tokens).parseProgram();
            log.info("[3/4] Parser: {} functions, {} classes", program.functions().size(), program.classes().size());

            renamed = AstPrinter.print(new VariableRenamer().rename(program));
            log.info("[4/4] Renamed locals");
        } catch (LexerException | ParseException e) {
            log.debug("Front end rejected {}", input, e);
            err.println(input + ": " + e.getMessage());
            return FAILED;
        }

        if (args.length == 2) {
            Path output = Path.of(args[1]);
            Files.writeString(output, renamed);
            log.info("Wrote {}", output);
        } else {
            out.print(renamed);
        }
        return OK;
    }
}
