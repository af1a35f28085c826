package com.vidnyan.sixer.domain.grammar;

/**
 * Rewrites every {@code <operand><suffix>} occurrence, e.g. {@code data.iteritems()},
 * where the operand is captured with {@link ExpressionGrammar}.
 *
 * <p>Occurrences whose operand cannot be captured are left untouched.
 */
public final class ReceiverCallRewriter {

    /**
     * Which operand shapes are accepted in front of the suffix.
     */
    public enum Operand {
        CHAIN,
        CHAIN_OR_PARENTHESIZED
    }

    /**
     * Builds the replacement for one occurrence; returning {@code null} keeps the
     * original text.
     */
    @FunctionalInterface
    public interface Replacement {
        String replace(Occurrence occurrence);
    }

    /**
     * One matched occurrence. {@code start} is the operand start, {@code end} the offset
     * right after the suffix.
     */
    public record Occurrence(String text, String operand, int start, int end) {

        /**
         * Operand without its outer parenthesis when it is a parenthesized expression.
         */
        public String unwrappedOperand() {
            if (operand.startsWith("(") && operand.endsWith(")")) {
                return operand.substring(1, operand.length() - 1);
            }
            return operand;
        }

        /**
         * Text of the line that precedes the operand.
         */
        public String linePrefix() {
            int lineStart = text.lastIndexOf('\n', start - 1) + 1;
            return text.substring(lineStart, start);
        }

        /**
         * Text of the line that follows the suffix.
         */
        public String lineSuffix() {
            int lineEnd = text.indexOf('\n', end);
            return text.substring(end, lineEnd < 0 ? text.length() : lineEnd);
        }
    }

    /**
     * Rewritten text and number of replaced occurrences.
     */
    public record Result(String content, int replacements) {

        public boolean changed() {
            return replacements > 0;
        }
    }

    private ReceiverCallRewriter() {
    }

    public static Result rewrite(String content, String suffix, Operand operand, Replacement replacement) {
        StringBuilder out = new StringBuilder(content.length() + 16);
        int copied = 0;
        int count = 0;
        int index = content.indexOf(suffix);
        while (index >= 0) {
            int start = operand == Operand.CHAIN
                    ? ExpressionGrammar.chainStart(content, index)
                    : ExpressionGrammar.operandStart(content, index);
            if (start != ExpressionGrammar.NO_MATCH && start >= copied) {
                int end = index + suffix.length();
                Occurrence occurrence = new Occurrence(content, content.substring(start, index), start, end);
                String replaced = replacement.replace(occurrence);
                if (replaced != null) {
                    out.append(content, copied, start).append(replaced);
                    copied = end;
                    count++;
                }
            }
            index = content.indexOf(suffix, index + suffix.length());
        }
        if (count == 0) {
            return new Result(content, 0);
        }
        out.append(content, copied, content.length());
        return new Result(out.toString(), count);
    }
}
