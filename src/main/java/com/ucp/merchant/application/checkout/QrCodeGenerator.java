package com.ucp.merchant.application.checkout;

/**
 * QR 이미지 생성 Port
 */
public interface QrCodeGenerator {

    /**
     * 내용을 인코딩한 PNG 이미지를 Base64 문자열로 반환
     */
    String toBase64Png(String content);
}
