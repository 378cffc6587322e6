package com.factory.palletizer.service;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * QR code of the pallet id for the printed pallet sheet.
 */
@Service
public class PalletLabelService {

    public byte[] renderLabel(String palletId, int size) {
        if (palletId == null || palletId.isBlank()) {
            throw new IllegalArgumentException("Pallet id is required for a label");
        }
        try {
            QRCodeWriter qrCodeWriter = new QRCodeWriter();
            BitMatrix bitMatrix = qrCodeWriter.encode(palletId, BarcodeFormat.QR_CODE, size, size);

            ByteArrayOutputStream pngOutputStream = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(bitMatrix, "PNG", pngOutputStream);
            return pngOutputStream.toByteArray();
        } catch (WriterException e) {
            throw new IllegalStateException("Cannot encode pallet id " + palletId + " as QR code", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write label image for pallet " + palletId, e);
        }
    }
}
