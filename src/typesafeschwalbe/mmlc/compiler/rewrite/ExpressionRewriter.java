
package typesafeschwalbe.mmlc.compiler.rewrite;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import typesafeschwalbe.mmlc.compiler.Error;
import typesafeschwalbe.mmlc.compiler.Result;
import typesafeschwalbe.mmlc.compiler.Source;
import typesafeschwalbe.mmlc.compiler.frontend.CandidateLookup;
import typesafeschwalbe.mmlc.compiler.frontend.ExprNode;
import typesafeschwalbe.mmlc.compiler.frontend.Term;

/**
 * Turns the flat term sequence of one expression into a finished tree.
 * Groups are built first, innermost groups before the groups containing
 * them, so that each group reaches the disambiguator as a single operand.
 * Nesting is tracked on an explicit stack, so deeply nested groups do not
 * grow the call stack.
 */
public class ExpressionRewriter {

    private static final Logger LOGGER
        = Logger.getLogger(ExpressionRewriter.class.getName());

    public static record Options(
        boolean keepGroups,
        boolean applyNullaryFunctions
    ) {
        public static final Options DEFAULT = new Options(false, true);
    }

    public static record Rewritten(ExprNode tree, List<Error> errors) {
        public boolean isValid() {
            return this.errors.isEmpty();
        }
    }

    private final Disambiguator disambiguator;
    private final TreeBuilder builder;
    private final Simplifier simplifier;

    public ExpressionRewriter() {
        this(Options.DEFAULT);
    }

    public ExpressionRewriter(Options options) {
        this.disambiguator = new Disambiguator(options.applyNullaryFunctions());
        this.builder = new TreeBuilder();
        this.simplifier = new Simplifier(options.keepGroups());
    }

    public Result<ExprNode> rewrite(
        List<Term> terms, Source span, CandidateLookup lookup
    ) {
        Rewritten rewritten = this.rewriteMarked(terms, span, lookup);
        if(!rewritten.isValid()) {
            return Result.ofError(rewritten.errors());
        }
        return Result.ofValue(rewritten.tree());
    }

    /**
     * Rewrites the expression without stopping at the first error. Every
     * part that could not be built is left in the tree as an invalid node
     * and all errors are returned next to it.
     */
    public Rewritten rewriteMarked(
        List<Term> terms, Source span, CandidateLookup lookup
    ) {
        List<Error> errors = new ArrayList<>();
        ExprNode built = this.construct(terms, span, lookup, errors);
        ExprNode tree = this.simplifier.simplify(built);
        if(LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(
                "rewrote " + span + " into " + tree
                    + " (" + errors.size() + " error(s))"
            );
        }
        return new Rewritten(tree, List.copyOf(errors));
    }

    // a term sequence whose groups are still being built
    private static class Sequence {

        private final List<Term> terms;
        private final Source span;
        private final List<Term> operands = new ArrayList<>();
        private final List<Error> errors = new ArrayList<>();
        private int next = 0;

        private Sequence(List<Term> terms, Source span) {
            this.terms = terms;
            this.span = span;
        }

    }

    // innermost groups are finished first and replace their group term with
    // the built node
    private ExprNode construct(
        List<Term> terms, Source span, CandidateLookup lookup,
        List<Error> errors
    ) {
        Deque<Sequence> open = new ArrayDeque<>();
        open.push(new Sequence(terms, span));
        while(true) {
            Sequence current = open.peek();
            if(current.next < current.terms.size()) {
                Term term = current.terms.get(current.next);
                current.next += 1;
                if(term.type == Term.Type.GROUP) {
                    open.push(new Sequence(
                        term.<Term.Group>getValue().terms(), term.source
                    ));
                } else {
                    current.operands.add(term);
                }
                continue;
            }
            open.pop();
            ExprNode built = this.buildSequence(
                current.operands, current.span, lookup, current.errors
            );
            if(open.isEmpty()) {
                errors.addAll(current.errors);
                return built;
            }
            Sequence parent = open.peek();
            parent.errors.addAll(current.errors);
            parent.operands.add(Term.node(
                current.errors.isEmpty()
                    ? ExprNode.group(built, current.span)
                    : ExprNode.invalid(current.errors, current.span)
            ));
        }
    }

    private ExprNode buildSequence(
        List<Term> operands, Source span, CandidateLookup lookup,
        List<Error> errors
    ) {
        Disambiguator.Tagging tagging = this.disambiguator.tag(
            operands, lookup
        );
        errors.addAll(tagging.errors());
        TreeBuilder.Built built = this.builder.construct(
            tagging.terms(), span
        );
        errors.addAll(built.errors());
        return built.tree();
    }

}
