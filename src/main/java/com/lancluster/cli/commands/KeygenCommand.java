package com.lancluster.cli.commands;

import com.lancluster.security.CipherCodec;
import com.lancluster.security.DerivedKey;
import com.lancluster.security.KeyFiles;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import javax.crypto.SecretKey;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.concurrent.Callable;

/**
 * Write a new bootstrap key file, random or derived from a password.
 */
@Command(name = "keygen", description = "Generate a bootstrap key file")
public class KeygenCommand implements Callable<Integer> {

    @Option(
        names = {"-k", "--key-file"},
        description = "File to write (default: ${DEFAULT-VALUE})",
        defaultValue = "lancluster.key"
    )
    Path keyFile;

    @Option(
        names = {"--password"},
        description = "Derive the key from a password (prompted) instead of generating it",
        interactive = true,
        arity = "0..1"
    )
    char[] password;

    @Option(
        names = {"--salt"},
        description = "Hex salt for password derivation (default: random)"
    )
    String saltHex;

    @Option(
        names = {"-f", "--force"},
        description = "Overwrite an existing key file"
    )
    boolean force;

    @Override
    public Integer call() throws Exception {
        if (Files.exists(keyFile) && !force) {
            System.err.println("Error: " + keyFile + " already exists (use --force to overwrite)");
            return 1;
        }

        SecretKey key;
        if (password != null) {
            DerivedKey derived;
            try {
                derived = saltHex != null
                        ? CipherCodec.deriveKey(password, HexFormat.of().parseHex(saltHex))
                        : CipherCodec.deriveKey(password);
            } finally {
                Arrays.fill(password, '\0');
            }
            key = derived.getKey();
            System.out.println("Derived key from password");
            System.out.println("  Salt: " + HexFormat.of().formatHex(derived.getSalt()));
        } else {
            key = CipherCodec.generateKey();
            System.out.println("Generated random key");
        }

        KeyFiles.save(key, keyFile);
        System.out.println("[OK] Key written to " + keyFile);
        System.out.println("  Encryption key: " + KeyFiles.fingerprint(key) + "...");
        return 0;
    }
}
