package com.couponengine.tokens;

import com.couponengine.common.exception.TokenSigningException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SigningKeyProvider} built from application properties.
 *
 * HMAC coupon keys are either the global secret or, with per-campaign keys enabled,
 * HMAC(secret, "campaign:" + id). RSA material is base64 DER (PKCS#8 private, X.509 public).
 * Missing material is replaced by ephemeral keys so a dev instance still starts; tokens
 * signed with them do not survive a restart.
 */
@Component
@Slf4j
public class ConfiguredSigningKeyProvider implements SigningKeyProvider {

    private static final int RSA_KEY_SIZE = 2048;

    private final SigningAlgorithm algorithm;
    private final boolean perCampaignKeys;
    private final HmacTokenSigner globalHmacSigner;
    private final RsaTokenSigner rsaSigner;
    private final Map<Long, TokenSigner> campaignSigners = new ConcurrentHashMap<>();

    public ConfiguredSigningKeyProvider(
            @Value("${coupon-engine.signing.algorithm:HMAC}") SigningAlgorithm algorithm,
            @Value("${coupon-engine.signing.secret:}") String secret,
            @Value("${coupon-engine.signing.per-campaign-keys:true}") boolean perCampaignKeys,
            @Value("${coupon-engine.signing.private-key:}") String privateKey,
            @Value("${coupon-engine.signing.public-key:}") String publicKey) {

        this.algorithm = algorithm;
        this.perCampaignKeys = perCampaignKeys;
        this.globalHmacSigner = new HmacTokenSigner(resolveSecret(secret));
        this.rsaSigner = resolveRsaSigner(privateKey, publicKey);

        log.info("Signing key provider initialized: couponAlgorithm={}, perCampaignKeys={}",
            algorithm, perCampaignKeys);
    }

    @Override
    public TokenSigner couponSigner(Long campaignId) {
        if (algorithm == SigningAlgorithm.RSA) {
            return rsaSigner;
        }
        if (!perCampaignKeys || campaignId == null) {
            return globalHmacSigner;
        }
        return campaignSigners.computeIfAbsent(campaignId, id ->
            new HmacTokenSigner(globalHmacSigner.sign(("campaign:" + id).getBytes(StandardCharsets.UTF_8))));
    }

    @Override
    public TokenSigner stationSigner() {
        return rsaSigner;
    }

    private static byte[] resolveSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            log.warn("No coupon signing secret configured; using an ephemeral secret");
            byte[] generated = new byte[32];
            new SecureRandom().nextBytes(generated);
            return generated;
        }
        try {
            return Base64.getDecoder().decode(secret.trim());
        } catch (IllegalArgumentException e) {
            throw new TokenSigningException("Signing secret is not valid base64", e);
        }
    }

    private static RsaTokenSigner resolveRsaSigner(String privateKey, String publicKey) {
        try {
            if (publicKey == null || publicKey.isBlank()) {
                log.warn("No RSA key pair configured; generating an ephemeral {}-bit pair", RSA_KEY_SIZE);
                KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
                generator.initialize(RSA_KEY_SIZE);
                KeyPair pair = generator.generateKeyPair();
                return new RsaTokenSigner(pair.getPrivate(), pair.getPublic());
            }
            KeyFactory keyFactory = KeyFactory.getInstance("RSA");
            PublicKey pub = keyFactory.generatePublic(
                new X509EncodedKeySpec(Base64.getDecoder().decode(publicKey.trim())));
            PrivateKey priv = privateKey == null || privateKey.isBlank()
                ? null
                : keyFactory.generatePrivate(new PKCS8EncodedKeySpec(Base64.getDecoder().decode(privateKey.trim())));
            return new RsaTokenSigner(priv, pub);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new TokenSigningException("Invalid RSA signing key material", e);
        }
    }
}
