package tw.gc.struggle.engine.services.ingest;

import org.springframework.stereotype.Component;
import tw.gc.struggle.engine.config.EngineProperties;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 over {@code sessionId|timestamp|nonce}, hex encoded.
 */
@Component
public class HmacVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public HmacVerifier(EngineProperties properties) {
        this.key = new SecretKeySpec(properties.getIngest().getHmacSecret().getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public String sign(String sessionId, long timestamp, String nonce) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal(message(sessionId, timestamp, nonce).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC unavailable", e);
        }
    }

    public boolean verify(String sessionId, long timestamp, String nonce, String signature) {
        if (signature == null) {
            return false;
        }
        byte[] expected = sign(sessionId, timestamp, nonce).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    private static String message(String sessionId, long timestamp, String nonce) {
        return sessionId + "|" + timestamp + "|" + nonce;
    }
}
