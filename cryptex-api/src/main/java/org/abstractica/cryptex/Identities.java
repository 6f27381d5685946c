package org.abstractica.cryptex;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validation rules for peer identities.
 *
 * <p>An identity is 3 to 20 characters of ASCII letters, digits and underscores.
 * The broadcast address {@link ChatClient#EVERYONE} is reserved.</p>
 */
public final class Identities
{
    public static final int MIN_LENGTH = 3;
    public static final int MAX_LENGTH = 20;

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_]+");

    private Identities() {}

    /**
     * Checks an identity against the naming rules.
     *
     * @param identity the candidate identity
     * @return a description of the first violated rule, or empty if valid
     */
    public static Optional<String> validate(String identity)
    {
        if (identity == null || identity.isEmpty())
        {
            return Optional.of("Identity cannot be empty");
        }
        if (identity.length() < MIN_LENGTH)
        {
            return Optional.of("Identity must be at least " + MIN_LENGTH + " characters");
        }
        if (identity.length() > MAX_LENGTH)
        {
            return Optional.of("Identity must not exceed " + MAX_LENGTH + " characters");
        }
        if (!ALLOWED.matcher(identity).matches())
        {
            return Optional.of("Identity can only contain letters, numbers, and underscores");
        }
        if (identity.equalsIgnoreCase(ChatClient.EVERYONE))
        {
            return Optional.of("Identity '" + identity + "' is reserved");
        }
        return Optional.empty();
    }

    /**
     * Returns whether an identity satisfies the naming rules.
     *
     * @param identity the candidate identity
     * @return true if valid
     */
    public static boolean isValid(String identity)
    {
        return validate(identity).isEmpty();
    }
}
