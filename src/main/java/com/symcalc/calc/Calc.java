package com.symcalc.calc;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import jline.console.ConsoleReader;

/**
 * Entry points of the engine, plus a small command line front end.
 *
 * <pre>
 *   Node ast = Calc.parseExpression("x = 5; x + 1");
 *   Object result = Calc.evaluateAST(ast, new HashMap&lt;String, Double&gt;()); // 6.0
 *   Node simpler = Calc.simplifyAST(Calc.parseExpression("x * 1 + 0")); // x
 * </pre>
 */
public class Calc {
    static boolean hadError = false;
    static boolean hadRuntimeError = false;
    public static Map<String, Boolean> debugKeys = new HashMap<>(); // given with -D flag, comma-separated

    private static boolean printSimplified = false; // -s
    private static boolean printTree = false; // -t
    private static boolean printSteps = false; // --steps

    public static List<Token> tokenize(String input) {
        return Scanner.tokenize(input);
    }

    public static Node parseExpression(String input) {
        List<Token> tokens = Scanner.tokenize(input);
        if (CalcUtil.isDebugEnabled("tokens")) {
            CalcUtil.debug("tokens", tokens.toString());
        }
        Node node = new Parser(tokens, input.length()).parse();
        if (CalcUtil.isDebugEnabled("ast")) {
            CalcUtil.debug("ast", AstPrinter.print(node));
        }
        return node;
    }

    // assignments are written through to the given map
    public static Object evaluateAST(Node node, Map<String, Double> scope) {
        return evaluateAST(node, new Scope(scope));
    }

    public static Object evaluateAST(Node node, Scope scope) {
        return new Evaluator().evaluate(node, scope);
    }

    public static Node simplifyAST(Node node) {
        Node simplified = new Simplifier().simplify(node);
        if (CalcUtil.isDebugEnabled("simplify")) {
            CalcUtil.debug("simplify", InfixPrinter.print(node) + " => " + InfixPrinter.print(simplified));
        }
        return simplified;
    }

    public static void main(String[] args) throws IOException {
        String expr = null;
        String debugKeysStr = null;
        int i = 0;

        while (i < args.length) {
            if (args[i].equals("-e") && i + 1 < args.length) {
                expr = args[i+1];
                i += 2;
            } else if (args[i].equals("-D") && i + 1 < args.length) {
                debugKeysStr = args[i+1];
                i += 2;
            } else if (args[i].equals("-s")) {
                printSimplified = true;
                i += 1;
            } else if (args[i].equals("-t")) {
                printTree = true;
                i += 1;
            } else if (args[i].equals("--steps")) {
                printSteps = true;
                i += 1;
            } else {
                System.err.println("Usage: Calc [-e EXPR] [-s] [-t] [--steps] [-D KEYS]");
                System.exit(1);
            }
        }

        if (debugKeysStr != null) {
            for (String key : debugKeysStr.split(",")) {
                debugKeys.put(key, true);
            }
        }

        if (expr == null) {
            runPrompt();
        } else {
            PrintWriter out = new PrintWriter(System.out, true);
            run(expr, new Scope(), out);
            if (hadError) System.exit(65);
            if (hadRuntimeError) System.exit(70);
        }
    }

    private static void runPrompt() throws IOException {
        ConsoleReader reader = new ConsoleReader();
        PrintWriter out = new PrintWriter(reader.getOutput(), true);
        reader.setPrompt("> ");

        // one scope for the whole session, so definitions carry over between lines
        Scope scope = new Scope();
        String line;
        for (;;) {
            line = reader.readLine();
            if (line == null) {
                break;
            }
            line = line.trim();
            if (line.equals("exit") || line.equals("quit")) {
                break;
            }
            if (line.equals("cls")) {
                reader.clearScreen();
                out.println(""); // avoid double-prompt at next input
                continue;
            }
            if (line.equals("vars")) {
                printVars(scope, out);
                continue;
            }
            if (line.isEmpty()) {
                continue;
            }
            run(line, scope, out);
            hadError = false;
            hadRuntimeError = false;
        }
    }

    static void run(String src, Scope scope, PrintWriter out) {
        Node node;
        try {
            node = parseExpression(src);
        } catch (CalcError error) {
            error(error);
            hadError = true;
            return;
        }

        if (printTree) {
            out.println(AstPrinter.print(node));
        }
        if (printSimplified) {
            out.println(InfixPrinter.print(simplifyAST(node)));
            return;
        }

        try {
            if (printSteps) {
                StepTracker tracker = new StepTracker();
                tracker.evaluateWithSteps(node, scope);
                for (SolutionStep step : tracker.getSteps()) {
                    out.println(step);
                }
            } else {
                out.println(Evaluator.stringify(evaluateAST(node, scope)));
            }
        } catch (EvalError error) {
            error(error);
            hadRuntimeError = true;
        }
    }

    private static void printVars(Scope scope, PrintWriter out) {
        for (Map.Entry<String, Double> entry : scope.values().entrySet()) {
            out.println(entry.getKey() + " = " + CalcUtil.formatNumber(entry.getValue()));
        }
        for (CalcCallable fn : scope.functions().values()) {
            out.println(fn);
        }
    }

    static void error(CalcError error) {
        if (error.getPosition() >= 0) {
            System.err.println("[position " + error.getPosition() + "] Error: " + error.getMessage());
        } else {
            System.err.println("Error: " + error.getMessage());
        }
    }
}
