package io.hostforge.provisioner.step.hardening;

import io.hostforge.provisioner.config.ConfigurationException;
import io.hostforge.provisioner.config.SshSettings;
import org.apache.sshd.common.config.keys.KeyUtils;
import org.apache.sshd.common.config.keys.writer.openssh.OpenSSHKeyPairResourceWriter;
import org.apache.sshd.common.keyprovider.FileKeyPairProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;

/**
 * The per-host key pair used for all access once it has been deployed.
 *
 * Keys live in the configured key directory as {@code hostforge_<host>} and
 * {@code hostforge_<host>.pub}, in OpenSSH format. An existing pair is always
 * reused, so re-running key generation never invalidates a deployed key.
 */
@Component
public class SshKeyService {

    private static final Logger log = LoggerFactory.getLogger(SshKeyService.class);

    private final SshSettings settings;

    public SshKeyService(SshSettings settings) {
        this.settings = settings;
    }

    /**
     * @param privateKeyPath absolute path of the private key
     * @param publicKey      the authorized_keys line
     * @param fingerprint    SHA256 fingerprint
     * @param reused         true when the pair already existed
     */
    public record HostKey(String privateKeyPath, String publicKey, String fingerprint, boolean reused) {}

    public Path privateKeyPath(String hostIdentifier) {
        return settings.keyDirectory().resolve("hostforge_" + hostIdentifier).toAbsolutePath();
    }

    /** Reuse the host's key pair, or generate one. */
    public HostKey ensureKeyPair(String hostIdentifier) {
        Optional<HostKey> existing = load(hostIdentifier);
        if (existing.isPresent()) {
            log.info("Reusing existing key pair {}", existing.get().privateKeyPath());
            return existing.get();
        }
        Path privateKey = privateKeyPath(hostIdentifier);
        Path publicKey  = publicKeyPath(privateKey);
        String comment  = "hostforge@" + hostIdentifier;
        try {
            KeyPair pair = generate();
            Files.createDirectories(privateKey.getParent());
            try (OutputStream out = Files.newOutputStream(privateKey)) {
                OpenSSHKeyPairResourceWriter.INSTANCE.writePrivateKey(pair, comment, null, out);
            }
            restrictToOwner(privateKey);
            try (OutputStream out = Files.newOutputStream(publicKey)) {
                OpenSSHKeyPairResourceWriter.INSTANCE.writePublicKey(pair.getPublic(), comment, out);
            }
            String fingerprint = KeyUtils.getFingerPrint(pair.getPublic());
            log.info("Generated {} key pair {} ({})", settings.keyType(), privateKey, fingerprint);
            return new HostKey(privateKey.toString(), readPublicKey(publicKey), fingerprint, false);
        } catch (IOException | GeneralSecurityException e) {
            throw new ConfigurationException("Could not generate SSH key pair at " + privateKey + ": " + e.getMessage(),
                    "Check that " + settings.keyDirectory() + " is writable (hostforge.ssh.key-directory).");
        }
    }

    /** The host's key pair if both files exist and the private key is readable. */
    public Optional<HostKey> load(String hostIdentifier) {
        Path privateKey = privateKeyPath(hostIdentifier);
        Path publicKey  = publicKeyPath(privateKey);
        if (!Files.exists(privateKey) || !Files.exists(publicKey)) {
            return Optional.empty();
        }
        try {
            Iterator<KeyPair> pairs = new FileKeyPairProvider(privateKey).loadKeys(null).iterator();
            if (!pairs.hasNext()) {
                return Optional.empty();
            }
            String fingerprint = KeyUtils.getFingerPrint(pairs.next().getPublic());
            return Optional.of(new HostKey(privateKey.toString(), readPublicKey(publicKey), fingerprint, true));
        } catch (IOException e) {
            throw new ConfigurationException("Unreadable private key " + privateKey + ": " + e.getMessage(),
                    "Remove " + privateKey + " and its .pub file to generate a new pair.");
        }
    }

    private KeyPair generate() throws GeneralSecurityException {
        String type = settings.keyType().toLowerCase(Locale.ROOT);
        KeyPairGenerator generator = switch (type) {
            case "rsa"   -> KeyPairGenerator.getInstance("RSA");
            case "ecdsa" -> KeyPairGenerator.getInstance("EC");
            default -> throw new ConfigurationException("Unsupported key type: " + settings.keyType(),
                    "Set hostforge.ssh.key-type to rsa or ecdsa.");
        };
        generator.initialize(settings.keySize());
        return generator.generateKeyPair();
    }

    private static Path publicKeyPath(Path privateKey) {
        return privateKey.resolveSibling(privateKey.getFileName() + ".pub");
    }

    private static String readPublicKey(Path publicKey) throws IOException {
        return Files.readString(publicKey, StandardCharsets.UTF_8).trim();
    }

    private static void restrictToOwner(Path file) throws IOException {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            log.debug("File system does not support POSIX permissions; leaving {} as is", file);
        }
    }
}
