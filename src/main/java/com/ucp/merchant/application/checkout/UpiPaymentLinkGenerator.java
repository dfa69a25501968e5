package com.ucp.merchant.application.checkout;

import com.ucp.merchant.config.UcpProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * UPI 딥링크 생성기
 *
 * 형식: upi://pay?pa=<vpa>&pn=<name>&am=<rupees>&tr=<session_id>&cu=INR&tn=Order_<session_id>
 * - am: paise 금액을 루피 단위 소수점 2자리로 표기 (100000 → 1000.00)
 * - tr: 체크아웃 세션 ID (결제 대사 키)
 */
@Component
public class UpiPaymentLinkGenerator {

    private final UcpProperties properties;

    public UpiPaymentLinkGenerator(UcpProperties properties) {
        this.properties = properties;
    }

    public String generate(long amountMinorUnits, String checkoutSessionId) {
        UcpProperties.Merchant merchant = properties.getMerchant();
        return "upi://pay"
                + "?pa=" + encode(merchant.getVpa())
                + "&pn=" + encode(merchant.getName())
                + "&am=" + formatRupees(amountMinorUnits)
                + "&tr=" + checkoutSessionId
                + "&cu=INR"
                + "&tn=" + encode("Order_" + checkoutSessionId);
    }

    public static String formatRupees(long amountMinorUnits) {
        return BigDecimal.valueOf(amountMinorUnits, 2).toPlainString();
    }

    /**
     * VPA의 '@'는 그대로 둔다 (UPI 앱 호환)
     */
    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%40", "@");
    }
}
