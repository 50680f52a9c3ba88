package com.symcalc.calc;

/**
 * Lisp-style dump of a tree, ex: "1+2*x" prints as "(+ 1.0 (* 2.0 (var x)))".
 */
public class AstPrinter implements Node.Visitor<String> {
    public static boolean silenceErrorOutput = false;
    public static String PARSE_ERROR = "!error!";

    public static String print(String src) {
        Node node;
        try {
            node = Parser.newFromSource(src).parse();
        } catch (CalcError err) {
            if (!silenceErrorOutput) {
                System.err.println("[Warning]: parse error: " + err.getMessage());
            }
            return PARSE_ERROR;
        }
        return print(node);
    }

    public static String print(Node node) {
        return node.accept(new AstPrinter());
    }

    @Override
    public String visitNumberLit(Node.NumberLit node) {
        return String.valueOf(node.value);
    }

    @Override
    public String visitComplexLit(Node.ComplexLit node) {
        return "(complex " + node.re + " " + node.im + ")";
    }

    @Override
    public String visitVariable(Node.Variable node) {
        return "(var " + node.name + ")";
    }

    @Override
    public String visitAssignment(Node.Assignment node) {
        return parenthesize("assign " + node.name, node.value);
    }

    @Override
    public String visitFunctionDef(Node.FunctionDef node) {
        StringBuilder builder = new StringBuilder();
        builder.append("(fnDef ").append(node.name).append(" (");
        for (int i = 0; i < node.params.size(); i++) {
            if (i > 0) builder.append(" ");
            builder.append(node.params.get(i));
        }
        builder.append(") ");
        builder.append(node.body.accept(this));
        builder.append(")");
        return builder.toString();
    }

    @Override
    public String visitBatch(Node.Batch node) {
        return parenthesize("batch", node.expressions.toArray(new Node[0]));
    }

    @Override
    public String visitBinaryOp(Node.BinaryOp node) {
        return parenthesize(node.op.symbol, node.left, node.right);
    }

    @Override
    public String visitFunctionCall(Node.FunctionCall node) {
        return parenthesize("call " + node.name, node.args.toArray(new Node[0]));
    }

    @Override
    public String visitUnaryMinus(Node.UnaryMinus node) {
        return parenthesize("-", node.operand);
    }

    private String parenthesize(String name, Node... nodes) {
        StringBuilder builder = new StringBuilder();

        builder.append("(").append(name);
        for (Node node : nodes) {
            builder.append(" ");
            builder.append(node.accept(this));
        }
        builder.append(")");

        return builder.toString();
    }
}
