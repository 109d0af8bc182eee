package com.stardust.api.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.stardust.api.SecureDataFixture;
import com.stardust.core.domain.DataCategory;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.util.Base64;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for authenticated encryption, key derivation and checksums.
 */
class CryptoServicePropertyTest {

    private static final ObjectMapper MAPPER = SecureDataFixture.MAPPER;
    private static final CategoryKeyRing KEYS = SecureDataFixture.keyRing();

    // ==================== Encryption symmetry ====================

    @Property(tries = 200)
    void decryptInvertsEncrypt(@ForAll byte[] plaintext) {
        CryptoService crypto = KEYS.root();

        String ciphertext = crypto.encrypt(plaintext);

        assertThat(crypto.decrypt(ciphertext)).isEqualTo(plaintext);
    }

    @Property(tries = 100)
    void encryptionIsRandomized(@ForAll("text") String plaintext) {
        CryptoService crypto = KEYS.root();

        String first = crypto.encryptString(plaintext);
        String second = crypto.encryptString(plaintext);

        assertThat(first).isNotEqualTo(second);
        assertThat(crypto.decryptString(first)).isEqualTo(crypto.decryptString(second)).isEqualTo(plaintext);
    }

    @Property(tries = 100)
    void flippingAnyCiphertextByteFailsDecryption(@ForAll("text") String plaintext, @ForAll int position) {
        CryptoService crypto = KEYS.root();
        byte[] raw = Base64.getUrlDecoder().decode(crypto.encryptString(plaintext));
        int index = Math.floorMod(position, raw.length);
        raw[index] ^= 0x01;
        String tampered = Base64.getUrlEncoder().encodeToString(raw);

        assertThatThrownBy(() -> crypto.decrypt(tampered))
                .isInstanceOf(CryptoService.DecryptionException.class);
    }

    @Property(tries = 50)
    void categoryKeysAreDistinct(@ForAll("text") String plaintext) {
        String ciphertext = KEYS.forCategory(DataCategory.PERSONAL_INFO).encryptString(plaintext);

        assertThatThrownBy(() -> KEYS.forCategory(DataCategory.MEDIA_FILES).decryptString(ciphertext))
                .isInstanceOf(CryptoService.DecryptionException.class);
        assertThatThrownBy(() -> KEYS.root().decryptString(ciphertext))
                .isInstanceOf(CryptoService.DecryptionException.class);
    }

    @Provide
    Arbitrary<String> text() {
        return Arbitraries.strings().alpha().numeric().withChars(" -_.@éß中").ofMaxLength(200);
    }

    // ==================== Object encryption ====================

    @Test
    void objectEncryptionRestoresJsonTypes() throws Exception {
        CryptoService crypto = KEYS.root();
        JsonNode value = MAPPER.readTree("{\"list\":[1,true,\"x\",null],\"n\":2.5}");

        assertThat(crypto.decryptObject(crypto.encryptObject(value))).isEqualTo(value);
        assertThat(crypto.decryptObject(crypto.encryptObject(MAPPER.readTree("42")))).isEqualTo(MAPPER.readTree("42"));
    }

    @Test
    void objectDecryptionFallsBackToPlainText() {
        CryptoService crypto = KEYS.root();

        assertThat(crypto.decryptObject(crypto.encryptString("not json {"))).isEqualTo(TextNode.valueOf("not json {"));
        assertThat(crypto.decryptObject(crypto.encryptString(""))).isEqualTo(TextNode.valueOf(""));
    }

    @Test
    void malformedCiphertextIsRejected() {
        CryptoService crypto = KEYS.root();

        assertThatThrownBy(() -> crypto.decrypt("%%%")).isInstanceOf(CryptoService.DecryptionException.class);
        assertThatThrownBy(() -> crypto.decrypt("")).isInstanceOf(CryptoService.DecryptionException.class);
        assertThatThrownBy(() -> crypto.decrypt("AAAA")).isInstanceOf(CryptoService.DecryptionException.class);
    }

    // ==================== Key derivation ====================

    @Test
    void samePassphraseYieldsSameKey() {
        SecretKey first = KeyDerivation.deriveKey("correct horse battery staple");
        SecretKey second = KeyDerivation.deriveKey("correct horse battery staple");
        SecretKey other = KeyDerivation.deriveKey("correct horse battery stapler");

        assertThat(first.getEncoded()).hasSize(32).isEqualTo(second.getEncoded());
        assertThat(other.getEncoded()).isNotEqualTo(first.getEncoded());
        assertThat(KeyDerivation.saltFor("abc")).hasSize(16);
    }

    @Test
    void keysDerivedFromSamePassphraseInteroperate() {
        CryptoService writer = CryptoService.fromPassphrase("shared-secret", "a", MAPPER);
        CryptoService reader = CryptoService.fromPassphrase("shared-secret", "b", MAPPER);

        assertThat(reader.decryptString(writer.encryptString("hello"))).isEqualTo("hello");
    }

    @Test
    void dedicatedCategoryPassphraseOverridesDerivedKey() {
        CategoryKeyRing ring = new CategoryKeyRing("root", Map.of(DataCategory.RATING_DATA, "ratings-only"), MAPPER);
        CryptoService dedicated = CryptoService.fromPassphrase("ratings-only", "x", MAPPER);

        String ciphertext = ring.forCategory(DataCategory.RATING_DATA).encryptString("5 stars");

        assertThat(dedicated.decryptString(ciphertext)).isEqualTo("5 stars");
        assertThat(ring.forCategory(DataCategory.RATING_DATA).keyId()).isEqualTo("rating_data_key");
    }

    // ==================== Checksums ====================

    @Test
    void checksumIsLowerCaseHexSha256() {
        assertThat(CryptoService.checksum("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(CryptoService.verifyChecksum("abc", CryptoService.checksum("abc"))).isTrue();
        assertThat(CryptoService.verifyChecksum("abd", CryptoService.checksum("abc"))).isFalse();
    }
}
