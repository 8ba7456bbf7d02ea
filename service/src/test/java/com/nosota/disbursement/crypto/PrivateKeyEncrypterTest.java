package com.nosota.disbursement.crypto;

import org.junit.jupiter.api.Test;
import org.stellar.sdk.KeyPair;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrivateKeyEncrypterTest {

    private final PrivateKeyEncrypter encrypter = new PrivateKeyEncrypter();

    @Test
    void testEncryptDecrypt() {
        String seed = new String(KeyPair.random().getSecretSeed());

        EncryptedKey encrypted = encrypter.encrypt(seed, "passphrase");

        assertThat(encrypted.cipherText()).doesNotContain(seed);
        assertThat(encrypter.decrypt(encrypted, "passphrase")).isEqualTo(seed);
    }

    @Test
    void testSameSecretNeverSharesCiphertext() {
        EncryptedKey first = encrypter.encrypt("secret", "passphrase");
        EncryptedKey second = encrypter.encrypt("secret", "passphrase");

        assertThat(first.cipherText()).isNotEqualTo(second.cipherText());
        assertThat(first.salt()).isNotEqualTo(second.salt());
    }

    @Test
    void testWrongPassphrase() {
        EncryptedKey encrypted = encrypter.encrypt("secret", "passphrase");

        assertThatThrownBy(() -> encrypter.decrypt(encrypted, "other"))
                .isInstanceOf(KeyEncryptionException.class);
    }

    @Test
    void testTamperedCiphertext() {
        EncryptedKey encrypted = encrypter.encrypt("secret", "passphrase");
        char[] chars = encrypted.cipherText().toCharArray();
        chars[20] = chars[20] == 'A' ? 'B' : 'A';
        EncryptedKey tampered = new EncryptedKey(new String(chars), encrypted.salt());

        assertThatThrownBy(() -> encrypter.decrypt(tampered, "passphrase"))
                .isInstanceOf(KeyEncryptionException.class);
        assertThatThrownBy(() -> encrypter.decrypt(new EncryptedKey("AAAA", encrypted.salt()), "passphrase"))
                .isInstanceOf(KeyEncryptionException.class);
    }

    @Test
    void testEmptyPassphrase() {
        assertThatThrownBy(() -> encrypter.encrypt("secret", " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
