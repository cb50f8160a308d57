
package typesafeschwalbe.mmlc.compiler.frontend;

import java.util.List;
import java.util.Map;

@FunctionalInterface
public interface CandidateLookup {

    /**
     * Returns every candidate visible for the given reference, in declaration
     * order. Returns an empty list for undeclared names, never null.
     */
    List<Candidate> candidatesFor(Term.Reference reference);

    static CandidateLookup of(Map<Term.Reference, List<Candidate>> candidates) {
        Map<Term.Reference, List<Candidate>> copied = Map.copyOf(candidates);
        return reference -> copied.getOrDefault(reference, List.of());
    }

}
