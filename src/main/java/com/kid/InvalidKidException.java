package com.kid;

/**
 * Indicates that a value could not be turned into a {@link Kid}.
 *
 * This is raised when:
 * <ul>
 *   <li>an encoded string is not exactly 16 characters long</li>
 *   <li>an encoded string contains a character outside the kid alphabet</li>
 *   <li>the decoded value fails the re-encode check on its last character</li>
 *   <li>a raw byte array is not exactly 10 bytes long</li>
 * </ul>
 */
public final class InvalidKidException extends RuntimeException {

    public InvalidKidException(String message) {
        super(message);
    }

    public InvalidKidException(String message, Throwable cause) {
        super(message, cause);
    }
}
