
package typesafeschwalbe.mmlc.compiler.rewrite;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import typesafeschwalbe.mmlc.compiler.Error;
import typesafeschwalbe.mmlc.compiler.Result;
import typesafeschwalbe.mmlc.compiler.Source;
import typesafeschwalbe.mmlc.compiler.frontend.ExprNode;
import typesafeschwalbe.mmlc.compiler.frontend.OperatorSignature;

/**
 * Builds an expression tree out of a role-tagged term sequence by precedence
 * climbing.
 *
 * <p>The climb is run on two explicit stacks instead of the call stack. Every
 * operator waiting on the operator stack stands for one pending recursion
 * level of the climb, whose minimum precedence is the operand precedence of
 * that operator. An incoming operator closes every pending level it is not
 * allowed to enter. Input of any nesting depth is therefore built without
 * growing the call stack.
 *
 * <p>When two infix operators of equal precedence but different
 * associativity meet, the associativity of the left one decides.
 */
public class TreeBuilder {

    public static record Built(ExprNode tree, List<Error> errors) {}

    public static Error missingRightOperandError(
        TaggedTerm operator, Source source
    ) {
        String note = operator.role == TaggedTerm.Role.APPLICATION
            ? "the application has no argument"
            : "'" + operator.<OperatorSignature>getValue().name()
                + "' has no right operand";
        return new Error(
            Error.Kind.MISSING_OPERAND,
            "Missing operand",
            Error.Marking.error(source, note)
        );
    }

    public static Error missingLeftOperandError(TaggedTerm operator) {
        String note = operator.role == TaggedTerm.Role.APPLICATION
            ? "the application has nothing to apply"
            : "'" + operator.<OperatorSignature>getValue().name()
                + "' has no left operand";
        return new Error(
            Error.Kind.MISSING_OPERAND,
            "Missing operand",
            Error.Marking.error(operator.source, note)
        );
    }

    public static Error emptyExpressionError(Source source) {
        return new Error(
            Error.Kind.MISSING_OPERAND,
            "Missing operand",
            Error.Marking.error(source, "expected an expression here")
        );
    }

    /**
     * Builds the tree for the given sequence. The span is the extent of the
     * whole expression and is only used to locate an empty expression.
     */
    public Result<ExprNode> build(List<TaggedTerm> terms, Source span) {
        Built built = this.construct(terms, span);
        if(!built.errors().isEmpty()) {
            return Result.ofError(built.errors());
        }
        return Result.ofValue(built.tree());
    }

    /**
     * Builds the tree for the given sequence, replacing every missing operand
     * with an invalid node so that a tree is always produced. The result is
     * wrapped into an expression node.
     */
    public Built construct(List<TaggedTerm> terms, Source span) {
        List<Error> errors = new ArrayList<>();
        Deque<ExprNode> operands = new ArrayDeque<>();
        Deque<TaggedTerm> operators = new ArrayDeque<>();
        boolean expectingOperand = true;
        for(TaggedTerm term: terms) {
            switch(term.role) {
                case OPERAND:
                case PREFIX: {
                    if(!expectingOperand) {
                        // two operands in a row are juxtaposed
                        TaggedTerm application = TaggedTerm.application(
                            term.source
                        );
                        TreeBuilder.closeLevels(
                            operands, operators, application.precedence()
                        );
                        operators.push(application);
                    }
                    if(term.role == TaggedTerm.Role.OPERAND) {
                        operands.push(term.getValue());
                        expectingOperand = false;
                    } else {
                        operators.push(term);
                        expectingOperand = true;
                    }
                    break;
                }
                case INFIX:
                case APPLICATION: {
                    if(expectingOperand) {
                        TreeBuilder.pushMissingLeftOperand(
                            term, operands, errors
                        );
                    }
                    TreeBuilder.closeLevels(
                        operands, operators, term.precedence()
                    );
                    operators.push(term);
                    expectingOperand = true;
                    break;
                }
                case POSTFIX: {
                    if(expectingOperand) {
                        TreeBuilder.pushMissingLeftOperand(
                            term, operands, errors
                        );
                    }
                    TreeBuilder.closeLevels(
                        operands, operators, term.precedence()
                    );
                    operands.push(ExprNode.postfix(
                        term.getValue(), term.source, operands.pop()
                    ));
                    expectingOperand = false;
                    break;
                }
            }
        }
        if(expectingOperand) {
            if(operators.isEmpty()) {
                Error error = TreeBuilder.emptyExpressionError(span);
                errors.add(error);
                return new Built(ExprNode.invalid(List.of(error), span), errors);
            }
            TaggedTerm dangling = operators.peek();
            Source missingAt = new Source(
                dangling.source.file(),
                dangling.source.endOffset(), dangling.source.endOffset()
            );
            Error error = TreeBuilder.missingRightOperandError(
                dangling, dangling.source
            );
            errors.add(error);
            operands.push(ExprNode.invalid(List.of(error), missingAt));
        }
        TreeBuilder.closeLevels(
            operands, operators, OperatorSignature.MIN_PRECEDENCE - 1L
        );
        if(operands.size() != 1 || !operators.isEmpty()) {
            throw new IllegalStateException(
                "expression construction left unused terms behind!"
            );
        }
        return new Built(ExprNode.expression(operands.pop()), errors);
    }

    private static void pushMissingLeftOperand(
        TaggedTerm operator, Deque<ExprNode> operands, List<Error> errors
    ) {
        Error error = TreeBuilder.missingLeftOperandError(operator);
        errors.add(error);
        operands.push(ExprNode.invalid(
            List.of(error),
            new Source(
                operator.source.file(),
                operator.source.startOffset(), operator.source.startOffset()
            )
        ));
    }

    // closes every pending level that an operator of the given precedence
    // may not enter
    private static void closeLevels(
        Deque<ExprNode> operands, Deque<TaggedTerm> operators, long precedence
    ) {
        while(!operators.isEmpty()
                && operators.peek().operandPrecedence() > precedence) {
            TreeBuilder.reduce(operands, operators.pop());
        }
    }

    private static void reduce(Deque<ExprNode> operands, TaggedTerm operator) {
        switch(operator.role) {
            case PREFIX: {
                ExprNode operand = operands.pop();
                operands.push(ExprNode.prefix(
                    operator.getValue(), operator.source, operand
                ));
                return;
            }
            case INFIX: {
                ExprNode right = operands.pop();
                ExprNode left = operands.pop();
                operands.push(ExprNode.binary(
                    operator.getValue(), operator.source, left, right
                ));
                return;
            }
            case APPLICATION: {
                ExprNode argument = operands.pop();
                ExprNode callee = operands.pop();
                operands.push(ExprNode.application(callee, argument));
                return;
            }
            case OPERAND:
            case POSTFIX: {
                throw new IllegalStateException(
                    "operands and postfix operators are never pending!"
                );
            }
        }
    }

}
