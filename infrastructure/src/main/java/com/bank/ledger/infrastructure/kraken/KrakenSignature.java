package com.bank.ledger.infrastructure.kraken;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * Kraken private endpoint signature:
 * Base64(HMAC-SHA512(uri path + SHA256(nonce + post data), Base64-decoded secret))
 */
public final class KrakenSignature {

    private KrakenSignature() {
    }

    public static String sign(String uriPath, String nonce, String postData, String secret) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] digest = sha256.digest((nonce + postData).getBytes(StandardCharsets.UTF_8));

            byte[] path = uriPath.getBytes(StandardCharsets.UTF_8);
            byte[] message = new byte[path.length + digest.length];
            System.arraycopy(path, 0, message, 0, path.length);
            System.arraycopy(digest, 0, message, path.length, digest.length);

            Mac mac = Mac.getInstance("HmacSHA512");
            mac.init(new SecretKeySpec(Base64.getDecoder().decode(secret), "HmacSHA512"));
            return Base64.getEncoder().encodeToString(mac.doFinal(message));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Kraken API secret is not valid Base64", e);
        } catch (Exception e) {
            throw new IllegalStateException("Unable to sign Kraken request: " + e.getMessage(), e);
        }
    }
}
