package com.ucp.merchant.infrastructure.payment;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import com.ucp.merchant.application.checkout.QrCodeGenerator;
import com.ucp.merchant.common.exception.ErrorCode;
import com.ucp.merchant.common.exception.SystemException;
import com.ucp.merchant.config.UcpProperties;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.EnumMap;
import java.util.Map;

/**
 * ZXing 기반 QR 이미지 생성 (PNG → Base64)
 */
@Component
public class ZxingQrCodeGenerator implements QrCodeGenerator {

    private static final int QUIET_ZONE_MODULES = 2;

    private final int size;

    public ZxingQrCodeGenerator(UcpProperties properties) {
        this.size = properties.getPayment().getQrSize();
    }

    @Override
    public String toBase64Png(String content) {
        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        hints.put(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());
        hints.put(EncodeHintType.MARGIN, QUIET_ZONE_MODULES);
        hints.put(EncodeHintType.ERROR_CORRECTION, ErrorCorrectionLevel.M);

        try {
            BitMatrix matrix = new QRCodeWriter().encode(content, BarcodeFormat.QR_CODE, size, size, hints);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(matrix, "PNG", out);
            return Base64.getEncoder().encodeToString(out.toByteArray());
        } catch (WriterException | IOException e) {
            throw new SystemException(ErrorCode.QR_GENERATION_FAILED, e);
        }
    }
}
