/*
 * Copyright (c) 2025 Martin Paljak
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.pgpcard.openpgp;

import org.bouncycastle.util.encoders.Hex;

// Thrown when card data is missing or not decodable, optionally includes the data in question.
@SuppressWarnings("serial")
public class OpenPGPDataException extends OpenPGPException {

    public enum Reason {
        // Operation on absent card data or a key slot the card reports as absent
        KEY_NOT_PRESENT,
        // Tag path missing from the card response
        NO_SUCH_TAG,
        // Algorithm identifier outside of the recognized range
        NO_SUCH_ALGORITHM,
        // Key origin code outside of the recognized range
        UNKNOWN_KEY_ORIGIN,
        // 1-based byte access out of bounds
        NOT_FOUND,
        // Present field shorter than required
        TOO_SHORT
    }

    private final Reason reason;

    public OpenPGPDataException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public OpenPGPDataException(Reason reason, String message, byte[] data) {
        this(reason, message + ": " + Hex.toHexString(data).toUpperCase());
    }

    // Annotates a failure with the field or operation it happened in, keeping the reason
    public OpenPGPDataException(String context, OpenPGPDataException cause) {
        super(context + ": " + cause.getMessage(), cause);
        this.reason = cause.reason;
    }

    public Reason getReason() {
        return reason;
    }
}
