
package typesafeschwalbe.mmlc.compiler.frontend;

import java.util.List;
import java.util.Optional;

import typesafeschwalbe.mmlc.compiler.Source;

public record Module(String name, List<Member> members) {

    public Module {
        members = List.copyOf(members);
    }

    public static record Parameter(String name, Source source) {}

    public static record Member(
        Kind kind,
        String name,
        List<Parameter> parameters,
        Optional<OperatorSignature> operator,
        List<Term> body,
        Source source
    ) {

        public enum Kind {
            BINDING,
            FUNCTION,
            OPERATOR
        }

        public Member {
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
            if((kind == Kind.OPERATOR) != operator.isPresent()) {
                throw new IllegalArgumentException(
                    "exactly the operator members carry an operator signature!"
                );
            }
        }

        public static Member binding(
            String name, List<Term> body, Source source
        ) {
            return new Member(
                Kind.BINDING, name, List.of(), Optional.empty(), body, source
            );
        }

        public static Member function(
            String name, List<Parameter> parameters, List<Term> body,
            Source source
        ) {
            return new Member(
                Kind.FUNCTION, name, parameters, Optional.empty(), body, source
            );
        }

        public static Member operator(
            OperatorSignature signature, List<Parameter> parameters,
            List<Term> body
        ) {
            return new Member(
                Kind.OPERATOR, signature.name(), parameters,
                Optional.of(signature), body, signature.source()
            );
        }

        public Candidate declaredCandidate() {
            return switch(this.kind) {
                case BINDING -> Candidate.binding(this.name, this.source);
                case FUNCTION -> Candidate.function(
                    this.name, this.parameters.size(), this.source
                );
                case OPERATOR -> Candidate.operator(this.operator.get());
            };
        }

    }

}
