
package typesafeschwalbe.mmlc.compiler.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import typesafeschwalbe.mmlc.compiler.Error;
import typesafeschwalbe.mmlc.compiler.Result;
import typesafeschwalbe.mmlc.compiler.Source;
import typesafeschwalbe.mmlc.compiler.frontend.Candidate;
import typesafeschwalbe.mmlc.compiler.frontend.CandidateLookup;
import typesafeschwalbe.mmlc.compiler.frontend.ExprNode;
import typesafeschwalbe.mmlc.compiler.frontend.OperatorSignature;
import typesafeschwalbe.mmlc.compiler.frontend.Term;

/**
 * Decides, left to right and without backtracking, which role each term of a
 * flat expression plays.
 *
 * <p>The scan only tracks whether the next term should start an operand or
 * continue one. Where an operand is expected, bindings and functions are
 * preferred over prefix operators. Where an operator is expected, infix
 * operators are preferred over postfix operators; any other term starts the
 * argument of an implicit application.
 *
 * <p>More than one distinct candidate for the chosen role is always reported
 * as an ambiguous reference. Identical candidates are collapsed first.
 * Bindings and functions count as the same (operand) role.
 */
public class Disambiguator {

    public static record Tagging(List<TaggedTerm> terms, List<Error> errors) {}

    public static Error unresolvableReferenceError(
        String name, Source source
    ) {
        return new Error(
            Error.Kind.UNRESOLVABLE_REFERENCE,
            "Unresolvable reference",
            Error.Marking.error(source, "'" + name + "' is not declared")
        );
    }

    public static Error ambiguousReferenceError(
        String name, Source source, List<Candidate> candidates
    ) {
        Error.Marking[] markings = new Error.Marking[candidates.size() + 1];
        markings[0] = Error.Marking.error(
            source,
            "'" + name + "' could refer to " + candidates.size()
                + " different declarations"
        );
        for(int candI = 0; candI < candidates.size(); candI += 1) {
            Candidate candidate = candidates.get(candI);
            markings[candI + 1] = Error.Marking.info(
                candidate.source, "could be the " + candidate.describe()
            );
        }
        return new Error(
            Error.Kind.AMBIGUOUS_REFERENCE, "Ambiguous reference", markings
        );
    }

    public static Error consecutivePostfixError(
        Term first, Term second
    ) {
        String secondName = second.<Term.Reference>getValue().name();
        String firstName = first.<Term.Reference>getValue().name();
        return new Error(
            Error.Kind.INVALID_CONSECUTIVE_POSTFIX,
            "Consecutive postfix operators",
            Error.Marking.error(
                second.source,
                "'" + secondName + "' directly follows the postfix operator '"
                    + firstName + "'"
            ),
            Error.Marking.info(first.source, "first postfix operator"),
            Error.Marking.help(
                second.source,
                "wrap the operand and the first operator in parentheses,"
                    + " as in '(x " + firstName + ") " + secondName + "'"
            )
        );
    }

    public static Error missingLeftOperandError(
        String operatorName, Source source
    ) {
        return new Error(
            Error.Kind.MISSING_OPERAND,
            "Missing operand",
            Error.Marking.error(
                source, "'" + operatorName + "' has no left operand"
            )
        );
    }

    private final boolean applyNullaryFunctions;

    public Disambiguator() {
        this(true);
    }

    public Disambiguator(boolean applyNullaryFunctions) {
        this.applyNullaryFunctions = applyNullaryFunctions;
    }

    public Result<List<TaggedTerm>> resolve(
        List<Term> terms, Map<Term.Reference, List<Candidate>> candidatesByRef
    ) {
        return this.resolve(terms, CandidateLookup.of(candidatesByRef));
    }

    public Result<List<TaggedTerm>> resolve(
        List<Term> terms, CandidateLookup lookup
    ) {
        Tagging tagging = this.tag(terms, lookup);
        if(!tagging.errors().isEmpty()) {
            return Result.ofError(tagging.errors());
        }
        return Result.ofValue(tagging.terms());
    }

    /**
     * Tags every term, replacing references that could not be resolved with
     * invalid operands so that the whole sequence is always tagged.
     * Group terms need to have been built into nodes beforehand.
     */
    public Tagging tag(List<Term> terms, CandidateLookup lookup) {
        List<TaggedTerm> tagged = new ArrayList<>();
        List<Error> errors = new ArrayList<>();
        boolean expectingOperand = true;
        Optional<Term> lastPostfix = Optional.empty();
        for(Term term: terms) {
            List<Candidate> candidates = Disambiguator.candidatesOf(
                term, lookup
            );
            if(!expectingOperand) {
                List<Candidate> infix = Disambiguator.filter(
                    candidates,
                    c -> c.hasRole(OperatorSignature.Role.INFIX_BINARY)
                );
                if(!infix.isEmpty()) {
                    tagged.add(this.operatorTag(term, infix, errors));
                    expectingOperand = true;
                    lastPostfix = Optional.empty();
                    continue;
                }
                List<Candidate> postfix = Disambiguator.filter(
                    candidates,
                    c -> c.hasRole(OperatorSignature.Role.POSTFIX_UNARY)
                );
                if(!postfix.isEmpty()) {
                    if(lastPostfix.isPresent()) {
                        errors.add(Disambiguator.consecutivePostfixError(
                            lastPostfix.get(), term
                        ));
                    }
                    tagged.add(this.operatorTag(term, postfix, errors));
                    lastPostfix = Optional.of(term);
                    continue;
                }
                // juxtaposition, the term starts the argument
                tagged.add(TaggedTerm.application(term.source));
                expectingOperand = true;
                lastPostfix = Optional.empty();
            }
            expectingOperand = this.tagInOperandPosition(
                term, candidates, tagged, errors
            );
            // a postfix operator missing its left operand still counts
            boolean taggedPostfix = tagged.get(tagged.size() - 1).role
                == TaggedTerm.Role.POSTFIX;
            lastPostfix = taggedPostfix ? Optional.of(term) : Optional.empty();
        }
        if(this.applyNullaryFunctions) {
            Disambiguator.applyNullaryFunctions(tagged);
        }
        return new Tagging(tagged, errors);
    }

    /**
     * Tags a term that should start an operand. Returns whether an operand
     * is still expected afterwards.
     */
    private boolean tagInOperandPosition(
        Term term, List<Candidate> candidates,
        List<TaggedTerm> tagged, List<Error> errors
    ) {
        return switch(term.type) {
            case LITERAL -> {
                tagged.add(TaggedTerm.operand(
                    ExprNode.literal(term.getValue(), term.source)
                ));
                yield false;
            }
            case NODE -> {
                tagged.add(TaggedTerm.operand(term.getValue()));
                yield false;
            }
            case GROUP -> throw new IllegalArgumentException(
                "groups need to be built before disambiguation!"
            );
            case REFERENCE -> this.tagReferenceInOperandPosition(
                term, candidates, tagged, errors
            );
        };
    }

    private boolean tagReferenceInOperandPosition(
        Term term, List<Candidate> candidates,
        List<TaggedTerm> tagged, List<Error> errors
    ) {
        String name = term.<Term.Reference>getValue().name();
        List<Candidate> operands = Disambiguator.filter(
            candidates, Candidate::isOperand
        );
        if(operands.size() == 1) {
            tagged.add(TaggedTerm.operand(
                ExprNode.reference(operands.get(0), term.source)
            ));
            return false;
        }
        if(operands.size() > 1) {
            Error error = Disambiguator.ambiguousReferenceError(
                name, term.source, operands
            );
            errors.add(error);
            tagged.add(TaggedTerm.operand(
                ExprNode.invalid(List.of(error), term.source)
            ));
            return false;
        }
        List<Candidate> prefix = Disambiguator.filter(
            candidates,
            c -> c.hasRole(OperatorSignature.Role.PREFIX_UNARY)
        );
        if(!prefix.isEmpty()) {
            tagged.add(this.operatorTag(term, prefix, errors));
            return true;
        }
        if(candidates.isEmpty()) {
            Error error = Disambiguator.unresolvableReferenceError(
                name, term.source
            );
            errors.add(error);
            tagged.add(TaggedTerm.operand(
                ExprNode.invalid(List.of(error), term.source)
            ));
            return false;
        }
        // only infix or postfix signatures, the left operand is missing
        Error error = Disambiguator.missingLeftOperandError(name, term.source);
        errors.add(error);
        tagged.add(TaggedTerm.operand(ExprNode.invalid(
            List.of(error), Disambiguator.startOf(term.source)
        )));
        List<Candidate> infix = Disambiguator.filter(
            candidates,
            c -> c.hasRole(OperatorSignature.Role.INFIX_BINARY)
        );
        if(!infix.isEmpty()) {
            tagged.add(this.operatorTag(term, infix, errors));
            return true;
        }
        tagged.add(this.operatorTag(term, candidates, errors));
        return false;
    }

    private TaggedTerm operatorTag(
        Term term, List<Candidate> candidates, List<Error> errors
    ) {
        if(candidates.size() > 1) {
            errors.add(Disambiguator.ambiguousReferenceError(
                term.<Term.Reference>getValue().name(), term.source, candidates
            ));
        }
        return TaggedTerm.operator(candidates.get(0).getValue(), term.source);
    }

    // a nullary function that is not the callee of an application is called
    // with the unit value
    private static void applyNullaryFunctions(List<TaggedTerm> tagged) {
        for(int termI = 0; termI < tagged.size(); termI += 1) {
            TaggedTerm term = tagged.get(termI);
            if(term.role != TaggedTerm.Role.OPERAND) {
                continue;
            }
            ExprNode node = term.getValue();
            if(node.type != ExprNode.Type.REFERENCE) {
                continue;
            }
            Candidate resolvedAs = node.<ExprNode.Reference>getValue()
                .resolvedAs();
            if(!resolvedAs.isNullaryFunction()) {
                continue;
            }
            boolean isCallee = termI + 1 < tagged.size()
                && tagged.get(termI + 1).role == TaggedTerm.Role.APPLICATION;
            if(isCallee) {
                continue;
            }
            Source end = new Source(
                node.source.file(),
                node.source.endOffset(), node.source.endOffset()
            );
            tagged.set(termI, TaggedTerm.operand(ExprNode.application(
                node, ExprNode.literal(Term.Literal.UNIT, end)
            )));
        }
    }

    private static List<Candidate> candidatesOf(
        Term term, CandidateLookup lookup
    ) {
        if(term.type != Term.Type.REFERENCE) {
            return List.of();
        }
        return lookup.candidatesFor(term.getValue()).stream()
            .distinct()
            .collect(Collectors.toList());
    }

    private static List<Candidate> filter(
        List<Candidate> candidates, Predicate<Candidate> condition
    ) {
        return candidates.stream()
            .filter(condition)
            .collect(Collectors.toList());
    }

    private static Source startOf(Source source) {
        return new Source(
            source.file(), source.startOffset(), source.startOffset()
        );
    }

}
