package subexpr.parse;

/**
 * Decides which characters may make up a name.
 * <p>
 * A letter is anything from {@code 'A'} to {@code 'z'} inclusive. Note that this also admits the six
 * characters between {@code 'Z'} and {@code 'a'}: {@code [ \ ] ^ _ `}. Expressions in the wild use them
 * in names, so the range must not be narrowed to A-Z and a-z.
 */
public class Letters {
    public static final char FIRST = 'A';
    public static final char LAST = 'z';

    public static boolean isLetter(char c) {
        return c >= FIRST && c <= LAST;
    }
}
