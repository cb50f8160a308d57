
package typesafeschwalbe.mmlc.compiler;

import java.util.Map;

public record Source(String file, int startOffset, int endOffset) {

    public Source {
        if(startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException(
                "Source offsets must satisfy 0 <= start <= end!"
            );
        }
    }

    public Source(Source start, Source end) {
        this(start.file, start.startOffset, end.endOffset);
        if(!start.file.equals(end.file)) {
            throw new IllegalArgumentException(
                "Provided source locations are not from the same file!"
            );
        }
    }

    public int computeLine(Map<String, String> files) {
        int lines = 1;
        String upTo = this.contentUpToStart(files);
        for(int charI = 0; charI < upTo.length(); charI += 1) {
            if(upTo.charAt(charI) == '\n') {
                lines += 1;
            }
        }
        return lines;
    }

    public int computeColumn(Map<String, String> files) {
        String upTo = this.contentUpToStart(files);
        return upTo.length() - (upTo.lastIndexOf('\n') + 1) + 1;
    }

    private String contentUpToStart(Map<String, String> files) {
        String content = files.get(this.file);
        if(content == null) {
            throw new IllegalArgumentException(
                "A source location refers to a file"
                    + " that is not present in the provided files!"
            );
        }
        return content.substring(0, Math.min(this.startOffset, content.length()));
    }

    @Override
    public String toString() {
        return "@\"" + this.file + "\"";
    }

}
