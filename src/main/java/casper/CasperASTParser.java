package casper;

import casper.ast.AstPrinter;
import casper.ast.Program;
import casper.error.CompileError;
import casper.error.SyntaxError;
import casper.semantics.SemanticAnalyzer;
import casper.syntax.AstBuilder;
import casper.syntax.CasperLexer;
import casper.syntax.CasperParser;
import casper.syntax.Preprocessor;
import org.antlr.v4.runtime.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Entry point of the Casper front end.
 *
 *   Program program = CasperASTParser.parse(text);
 *
 * runs the whole pipeline: indentation preprocessing, grammar matching with
 * the ANTLR-generated recognizer, AST construction and semantic analysis.
 * Any failure surfaces as a single {@link CompileError}; there is no partial
 * result. Calls share nothing but the generated recognizer's immutable
 * grammar tables, so independent calls may run on different threads.
 */
public final class CasperASTParser {

    private static final Logger logger = LoggerFactory.getLogger(CasperASTParser.class);

    private CasperASTParser() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    // =====================================================================
    // MAIN PARSING ORCHESTRATION
    // =====================================================================

    /** Parses and validates {@code text}, returning the root of the validated AST. */
    public static Program parse(String text) {
        Program program = parseSyntax(text);
        new SemanticAnalyzer().analyze(program);
        return program;
    }

    /** Preprocesses, matches and builds the AST of {@code text} without semantic analysis. */
    public static Program parseSyntax(String text) {
        String preprocessed = Preprocessor.withIndentsAndDedents(text);

        CasperLexer lexer = new CasperLexer(CharStreams.fromString(preprocessed));
        setupErrorHandling(lexer);
        CasperParser parser = new CasperParser(new CommonTokenStream(lexer));
        setupErrorHandling(parser);

        CasperParser.ProgramContext tree = parser.program();
        logger.debug("Parse tree generated with {} top-level statements", tree.statement().size());
        return new AstBuilder().build(tree);
    }

    // =====================================================================
    // ERROR HANDLING SETUP
    // =====================================================================

    private static void setupErrorHandling(Lexer lexer) {
        lexer.removeErrorListeners();
        lexer.addErrorListener(new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                    int line, int charPositionInLine, String msg, RecognitionException e) {
                throw newSyntaxError(line, charPositionInLine, msg);
            }
        });
    }

    private static void setupErrorHandling(Parser parser) {
        parser.removeErrorListeners();
        parser.addErrorListener(new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                    int line, int charPositionInLine, String msg, RecognitionException e) {
                throw newSyntaxError(line, charPositionInLine, msg);
            }
        });
    }

    private static SyntaxError newSyntaxError(int line, int charPositionInLine, String msg) {
        String readable = msg
            .replace(String.valueOf(Preprocessor.INDENT), "<indent>")
            .replace(String.valueOf(Preprocessor.DEDENT), "<dedent>");
        return new SyntaxError("Syntax Error: line " + line + ":" + charPositionInLine + " - " + readable,
            line, charPositionInLine);
    }

    // =====================================================================
    // COMMAND LINE
    // =====================================================================

    static int run(String[] args, PrintStream out) {
        if (args.length < 1) {
            System.err.println("Usage: java casper.CasperASTParser <casper-file> [--tokens|--grammar-only|--profile]");
            return 2;
        }

        String sourceFile = args[0];
        boolean debugTokens = false;
        boolean grammarOnly = false;
        boolean profile = false;
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--tokens":
                    debugTokens = true;
                    break;
                case "--grammar-only":
                    grammarOnly = true;
                    break;
                case "--profile":
                    profile = true;
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
                    return 2;
            }
        }

        String text;
        try {
            text = new String(Files.readAllBytes(Paths.get(sourceFile)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Cannot read " + sourceFile + ": " + e.getMessage());
            return 1;
        }

        try {
            if (debugTokens) {
                out.print(Preprocessor.withIndentsAndDedents(text)
                    .replace(String.valueOf(Preprocessor.INDENT), "<indent>")
                    .replace(String.valueOf(Preprocessor.DEDENT), "<dedent>"));
                return 0;
            }

            logger.info("Parsing {}", sourceFile);
            long startTime = System.currentTimeMillis();
            Program program = parseSyntax(text);
            long parseTime = System.currentTimeMillis() - startTime;

            if (!grammarOnly) {
                long analysisStart = System.currentTimeMillis();
                new SemanticAnalyzer().analyze(program);
                if (profile) {
                    logger.info("Profiling: semantic analysis in {}ms", System.currentTimeMillis() - analysisStart);
                }
            }
            if (profile) {
                logger.info("Profiling: preprocessing and parsing in {}ms", parseTime);
            }

            out.println(AstPrinter.print(program));
            logger.info("{} accepted with {} top-level statements", sourceFile, program.getBody().size());
            return 0;
        } catch (CompileError e) {
            System.err.println(e.getMessage());
            return 1;
        }
    }
}
