
package typesafeschwalbe.mmlc.compiler.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import typesafeschwalbe.mmlc.compiler.Error;
import typesafeschwalbe.mmlc.compiler.frontend.Candidate;
import typesafeschwalbe.mmlc.compiler.frontend.ExprNode;
import typesafeschwalbe.mmlc.compiler.frontend.Module;
import typesafeschwalbe.mmlc.compiler.frontend.Scope;

/**
 * Rewrites the bodies of all members of a module.
 *
 * <p>The declarations of the module are added to the outer scope first, so
 * every member may refer to every other member regardless of declaration
 * order. Inside a member, its parameters hide module level declarations of
 * the same name. A member that fails to rewrite keeps its place in the
 * output with invalid markers in its body, and the remaining members are
 * still rewritten.
 */
public class ModuleRewriter {

    private static final Logger LOGGER
        = Logger.getLogger(ModuleRewriter.class.getName());

    public static record RewrittenMember(
        Module.Member member,
        ExprNode body,
        List<Error> errors
    ) {
        public boolean isValid() {
            return this.errors.isEmpty();
        }
    }

    public static record Output(
        List<RewrittenMember> members,
        List<Error> errors
    ) {
        public boolean isValid() {
            return this.errors.isEmpty();
        }

        public Optional<RewrittenMember> member(String name) {
            for(RewrittenMember rewritten: this.members) {
                if(rewritten.member().name().equals(name)) {
                    return Optional.of(rewritten);
                }
            }
            return Optional.empty();
        }
    }

    private final Scope outer;
    private final ExpressionRewriter expressions;

    public ModuleRewriter(Scope outer) {
        this(outer, new ExpressionRewriter());
    }

    public ModuleRewriter(Scope outer, ExpressionRewriter expressions) {
        this.outer = outer;
        this.expressions = expressions;
    }

    public Output rewrite(Module module) {
        List<Error> errors = new ArrayList<>();
        Scope.Builder declared = this.outer.extend();
        for(Module.Member member: module.members()) {
            declared.add(member.declaredCandidate()).ifPresent(errors::add);
        }
        Scope scope = declared.build();
        List<RewrittenMember> members = new ArrayList<>();
        for(Module.Member member: module.members()) {
            List<Candidate> parameters = member.parameters().stream()
                .map(p -> Candidate.binding(p.name(), p.source()))
                .collect(Collectors.toList());
            ExpressionRewriter.Rewritten body = this.expressions.rewriteMarked(
                member.body(), member.source(), scope.shadowedBy(parameters)
            );
            members.add(new RewrittenMember(member, body.tree(), body.errors()));
            errors.addAll(body.errors());
        }
        if(LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(
                "rewrote module '" + module.name() + "' with "
                    + members.size() + " member(s) and "
                    + errors.size() + " error(s)"
            );
        }
        return new Output(List.copyOf(members), List.copyOf(errors));
    }

}
