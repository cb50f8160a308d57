
package typesafeschwalbe.mmlc.compiler.rewrite;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import typesafeschwalbe.mmlc.compiler.frontend.ExprNode;

/**
 * Removes the wrapper nodes left behind by tree construction.
 *
 * <p>Expression wrappers are always replaced by their child. Group wrappers
 * are replaced as well unless groups are kept. Every other node is rebuilt
 * with its simplified children, so the result only differs from the input
 * in the wrappers it no longer has. Simplifying twice gives the same tree as
 * simplifying once.
 */
public class Simplifier {

    private static record Frame(ExprNode node, boolean childrenDone) {}

    private final boolean keepGroups;

    public Simplifier() {
        this(false);
    }

    public Simplifier(boolean keepGroups) {
        this.keepGroups = keepGroups;
    }

    public ExprNode simplify(ExprNode root) {
        // post-order walk, simplified children are collected on 'done'
        Deque<Frame> pending = new ArrayDeque<>();
        Deque<ExprNode> done = new ArrayDeque<>();
        pending.push(new Frame(root, false));
        while(!pending.isEmpty()) {
            Frame frame = pending.pop();
            List<ExprNode> children = frame.node().children();
            if(!frame.childrenDone()) {
                pending.push(new Frame(frame.node(), true));
                for(int childI = children.size() - 1; childI >= 0; childI -= 1) {
                    pending.push(new Frame(children.get(childI), false));
                }
                continue;
            }
            List<ExprNode> simplified = new ArrayList<>(children.size());
            for(int childI = 0; childI < children.size(); childI += 1) {
                simplified.add(0, done.pop());
            }
            done.push(this.simplifyNode(frame.node(), simplified));
        }
        return done.pop();
    }

    private ExprNode simplifyNode(ExprNode node, List<ExprNode> children) {
        return switch(node.type) {
            case EXPRESSION -> children.get(0);
            case GROUP -> this.keepGroups
                ? node.withChildren(children)
                : children.get(0);
            case UNARY, BINARY, APPLICATION -> node.withChildren(children);
            case LITERAL, REFERENCE, INVALID -> node;
        };
    }

}
