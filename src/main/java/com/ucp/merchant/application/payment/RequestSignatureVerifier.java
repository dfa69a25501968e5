package com.ucp.merchant.application.payment;

import com.ucp.merchant.config.UcpProperties;
import com.ucp.merchant.domain.checkout.CheckoutSession;
import com.ucp.merchant.domain.payment.InvalidSignatureException;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * 요청 서명 검증기
 *
 * 서명 = hex(HMAC-SHA256(merchant secret, "id|totalMinorUnits|buyerId"))
 * 비교는 상수 시간(MessageDigest.isEqual)으로 수행한다.
 */
@Component
public class RequestSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private final SecretKeySpec key;

    public RequestSignatureVerifier(UcpProperties properties) {
        String secret = properties.getMerchant().getSigningSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("ucp.merchant.signing-secret 설정이 필요합니다");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    /**
     * 세션의 고정 페이로드에 대한 서명 생성
     */
    public String sign(CheckoutSession session) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal(session.signaturePayload().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 서명 생성 실패", e);
        }
    }

    /**
     * @throws InvalidSignatureException 서명이 없거나 일치하지 않는 경우
     */
    public void verify(CheckoutSession session, String requestSignature) {
        if (requestSignature == null || requestSignature.isBlank()) {
            throw new InvalidSignatureException(session.getId());
        }
        String provided = requestSignature.trim().toLowerCase(Locale.ROOT);
        if (provided.startsWith(PREFIX)) {
            provided = provided.substring(PREFIX.length());
        }
        byte[] expected = sign(session).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, provided.getBytes(StandardCharsets.US_ASCII))) {
            throw new InvalidSignatureException(session.getId());
        }
    }
}
