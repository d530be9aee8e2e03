package dao.subnet.settle.crypto;

import dao.subnet.settle.config.SettlementProperties;
import lombok.extern.slf4j.Slf4j;
import org.stellar.sdk.KeyPair;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Signers this node holds for the vault, loaded from configured secret seeds.
 */
@Slf4j
@Component
public class SignerKeyring {

    private final List<KeyPair> signers;

    public SignerKeyring(SettlementProperties props) {
        List<KeyPair> loaded = new ArrayList<>();
        List<String> seeds = props.getSignerSeeds();
        if (seeds == null || seeds.isEmpty()) {
            log.warn("No signer seeds configured. Set settlement.signer-seeds to enable settlement signing.");
        } else {
            for (int i = 0; i < seeds.size(); i++) {
                String seed = seeds.get(i);
                if (seed == null || seed.isBlank()) {
                    continue;
                }
                try {
                    KeyPair signer = KeyPair.fromSecretSeed(seed.trim());
                    loaded.add(signer);
                    log.info("Loaded vault signer #{}: {}", i, signer.getAccountId());
                } catch (RuntimeException e) {
                    log.error("Signer seed #{} is invalid and was skipped: {}", i, e.getMessage());
                }
            }
        }
        this.signers = Collections.unmodifiableList(loaded);
    }

    public List<KeyPair> availableSigners() {
        return signers;
    }
}
