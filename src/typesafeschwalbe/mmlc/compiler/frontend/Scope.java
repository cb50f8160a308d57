
package typesafeschwalbe.mmlc.compiler.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import typesafeschwalbe.mmlc.compiler.Error;

/**
 * An immutable mapping from names to the candidates declared under them.
 * Operator declarations are validated when they are added, so a built scope
 * never holds two signatures of the same role for one name, nor two infix
 * operators sharing a precedence with different associativity.
 */
public class Scope implements CandidateLookup {

    public static final Scope EMPTY = new Scope(Map.of());

    public static Error duplicateOperatorError(
        OperatorSignature duplicate, OperatorSignature original
    ) {
        return new Error(
            Error.Kind.DUPLICATE_OPERATOR,
            "Duplicate operator",
            Error.Marking.error(
                duplicate.source(),
                "a " + duplicate.role().description + " operator '"
                    + duplicate.name() + "' was already declared"
            ),
            Error.Marking.info(original.source(), "previously declared here")
        );
    }

    public static Error conflictingAssociativityError(
        OperatorSignature declared, OperatorSignature existing
    ) {
        return new Error(
            Error.Kind.CONFLICTING_ASSOCIATIVITY,
            "Conflicting operator associativity",
            Error.Marking.error(
                declared.source(),
                "'" + declared.name() + "' is "
                    + declared.associativity().name().toLowerCase()
                    + " associative at precedence " + declared.precedence()
            ),
            Error.Marking.info(
                existing.source(),
                "but '" + existing.name() + "' shares that precedence and is "
                    + existing.associativity().name().toLowerCase()
                    + " associative"
            ),
            Error.Marking.help(
                declared.source(),
                "give one of the operators a different precedence"
            )
        );
    }

    private final Map<String, List<Candidate>> candidates;

    private Scope(Map<String, List<Candidate>> candidates) {
        this.candidates = candidates;
    }

    public static Builder builder() {
        return new Builder(Map.of());
    }

    public Builder extend() {
        return new Builder(this.candidates);
    }

    @Override
    public List<Candidate> candidatesFor(Term.Reference reference) {
        return this.candidatesFor(reference.name());
    }

    public List<Candidate> candidatesFor(String name) {
        return this.candidates.getOrDefault(name, List.of());
    }

    /**
     * Returns a scope in which every name declared by the given candidates
     * refers only to those candidates, hiding whatever this scope declared
     * under the same name.
     */
    public Scope shadowedBy(List<Candidate> inner) {
        if(inner.isEmpty()) {
            return this;
        }
        Map<String, List<Candidate>> shadowing = new LinkedHashMap<>();
        for(Candidate candidate: inner) {
            shadowing.computeIfAbsent(candidate.name(), n -> new ArrayList<>())
                .add(candidate);
        }
        Map<String, List<Candidate>> result
            = new LinkedHashMap<>(this.candidates);
        for(String name: shadowing.keySet()) {
            result.put(name, List.copyOf(shadowing.get(name)));
        }
        return new Scope(Collections.unmodifiableMap(result));
    }

    public static class Builder {

        private final Map<String, List<Candidate>> candidates;

        private Builder(Map<String, List<Candidate>> initial) {
            this.candidates = new LinkedHashMap<>();
            for(String name: initial.keySet()) {
                this.candidates.put(name, new ArrayList<>(initial.get(name)));
            }
        }

        public Optional<Error> add(Candidate candidate) {
            List<Candidate> sameName = this.candidates.getOrDefault(
                candidate.name(), List.of()
            );
            if(sameName.contains(candidate)) {
                return Optional.empty();
            }
            if(candidate.type == Candidate.Type.OPERATOR) {
                Optional<Error> error = this.validate(
                    candidate.getValue(), sameName
                );
                if(error.isPresent()) {
                    return error;
                }
            }
            this.candidates
                .computeIfAbsent(candidate.name(), n -> new ArrayList<>())
                .add(candidate);
            return Optional.empty();
        }

        public List<Error> addAll(List<Candidate> candidates) {
            List<Error> errors = new ArrayList<>();
            for(Candidate candidate: candidates) {
                this.add(candidate).ifPresent(errors::add);
            }
            return errors;
        }

        private Optional<Error> validate(
            OperatorSignature declared, List<Candidate> sameName
        ) {
            for(Candidate existing: sameName) {
                if(existing.hasRole(declared.role())) {
                    return Optional.of(Scope.duplicateOperatorError(
                        declared, existing.getValue()
                    ));
                }
            }
            if(declared.role() != OperatorSignature.Role.INFIX_BINARY) {
                return Optional.empty();
            }
            for(List<Candidate> declaredUnder: this.candidates.values()) {
                for(Candidate existing: declaredUnder) {
                    if(!existing.hasRole(OperatorSignature.Role.INFIX_BINARY)) {
                        continue;
                    }
                    OperatorSignature other = existing.getValue();
                    if(other.precedence() == declared.precedence()
                        && other.associativity() != declared.associativity()) {
                        return Optional.of(Scope.conflictingAssociativityError(
                            declared, other
                        ));
                    }
                }
            }
            return Optional.empty();
        }

        public Scope build() {
            Map<String, List<Candidate>> built = new LinkedHashMap<>();
            for(String name: this.candidates.keySet()) {
                built.put(name, List.copyOf(this.candidates.get(name)));
            }
            return new Scope(Collections.unmodifiableMap(built));
        }

    }

}
