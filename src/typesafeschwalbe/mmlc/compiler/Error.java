
package typesafeschwalbe.mmlc.compiler;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

public record Error(
    Kind kind,
    String message,
    Marking... markings
) {

    public enum Kind {
        UNRESOLVABLE_REFERENCE("unresolvable-reference"),
        AMBIGUOUS_REFERENCE("ambiguous-reference"),
        INVALID_CONSECUTIVE_POSTFIX("invalid-consecutive-postfix"),
        MISSING_OPERAND("missing-operand"),
        DUPLICATE_OPERATOR("duplicate-operator"),
        CONFLICTING_ASSOCIATIVITY("conflicting-associativity");

        public final String rule;

        private Kind(String rule) {
            this.rule = rule;
        }
    }

    public static record Marking(Type type, Source location, String note) {

        public enum Type {
            ERROR('^'),
            INFO('~'),
            HELP('*');

            private final char marker;

            private Type(char marker) {
                this.marker = marker;
            }
        }

        public static Marking error(Source location, String note) {
            return new Marking(Type.ERROR, location, note);
        }

        public static Marking info(Source location, String note) {
            return new Marking(Type.INFO, location, note);
        }

        public static Marking help(Source location, String note) {
            return new Marking(Type.HELP, location, note);
        }

    }

    public Source primaryLocation() {
        for(Marking marking: this.markings) {
            if(marking.type == Marking.Type.ERROR) {
                return marking.location;
            }
        }
        if(this.markings.length == 0) {
            throw new IllegalStateException(
                "Attempted to locate an error without any markings!"
            );
        }
        return this.markings[0].location;
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Error)) { return false; }
        Error other = (Error) otherRaw;
        return this.kind == other.kind
            && this.message.equals(other.message)
            && Arrays.equals(this.markings, other.markings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            this.kind, this.message, Arrays.hashCode(this.markings)
        );
    }

    @Override
    public String toString() {
        return "error[" + this.kind.rule + "]: " + this.message;
    }

    public String render(Map<String, String> files) {
        StringBuilder output = new StringBuilder();
        output.append(this.toString());
        output.append("\n");
        for(Marking marked: this.markings) {
            output.append("  ");
            output.append(marked.type.marker);
            output.append(" ");
            output.append(marked.location.file());
            output.append(":");
            output.append(marked.location.computeLine(files));
            output.append(":");
            output.append(marked.location.computeColumn(files));
            output.append(" ");
            output.append(marked.note);
            output.append("\n");
        }
        return output.toString();
    }

}
