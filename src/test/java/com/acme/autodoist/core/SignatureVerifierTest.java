package com.acme.autodoist.core;

import com.acme.autodoist.support.Signatures;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HexFormat;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SignatureVerifierTest {

    private static final String SECRET = "s3cret";
    private static final String BODY = "{\"event_name\":\"item:completed\"}";
    private static final byte[] RAW = BODY.getBytes(StandardCharsets.UTF_8);

    @Test
    void testAcceptsBase64Digest() {
        assertTrue(SignatureVerifier.verify(RAW, Signatures.base64(BODY, SECRET), SECRET));
    }

    @Test
    void testAcceptsHexDigest() {
        byte[] digest = Base64.getDecoder().decode(Signatures.base64(BODY, SECRET));
        assertTrue(SignatureVerifier.verify(RAW, HexFormat.of().formatHex(digest), SECRET));
    }

    @Test
    void testTrimsHeaderWhitespace() {
        assertTrue(SignatureVerifier.verify(RAW, "  " + Signatures.base64(BODY, SECRET) + " ", SECRET));
    }

    @Test
    void testRejectsWrongSecretOrTamperedBody() {
        String sig = Signatures.base64(BODY, SECRET);
        assertFalse(SignatureVerifier.verify(RAW, sig, "other"));
        assertFalse(SignatureVerifier.verify((BODY + " ").getBytes(StandardCharsets.UTF_8), sig, SECRET));
    }

    @Test
    void testRejectsMissingHeaderOrSecret() {
        assertFalse(SignatureVerifier.verify(RAW, "", SECRET));
        assertFalse(SignatureVerifier.verify(RAW, null, SECRET));
        assertFalse(SignatureVerifier.verify(RAW, Signatures.base64(BODY, SECRET), ""));
        assertFalse(SignatureVerifier.verify(RAW, Signatures.base64(BODY, SECRET), null));
    }

    @Test
    void testSha256Hex() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
            SignatureVerifier.sha256Hex(new byte[0]));
    }
}
