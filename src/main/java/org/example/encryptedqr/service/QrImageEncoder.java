package org.example.encryptedqr.service;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageConfig;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import lombok.extern.slf4j.Slf4j;
import org.example.encryptedqr.common.ImageQuality;
import org.example.encryptedqr.common.QrSize;
import org.example.encryptedqr.util.HexColors;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Renders envelope text as a QR symbol at error correction level H. Every module gets the
 * same whole number of pixels; the symbol is centred and the remainder is background.
 */
@Slf4j
@Component
public class QrImageEncoder {
    public static final ErrorCorrectionLevel ERROR_CORRECTION = ErrorCorrectionLevel.H;
    static final int QUIET_ZONE = 4;

    private final QRCodeWriter qrCodeWriter = new QRCodeWriter();

    public byte[] encodePng(String payload, QrSize size, String foreground, String background,
                            ImageQuality quality) throws WriterException, IOException {
        BufferedImage image = render(payload, size, foreground, background);
        return writePng(image, quality);
    }

    public BufferedImage render(String payload, QrSize size, String foreground, String background)
            throws WriterException {
        Color fg = HexColors.parse("QR color", foreground);
        Color bg = HexColors.parse("QR background color", background);
        int edge = size.getPixels();

        // envelope text is plain ASCII, so no CHARACTER_SET hint and no ECI header
        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        hints.put(EncodeHintType.ERROR_CORRECTION, ERROR_CORRECTION);
        hints.put(EncodeHintType.MARGIN, QUIET_ZONE);

        BitMatrix matrix = qrCodeWriter.encode(payload, BarcodeFormat.QR_CODE, edge, edge, hints);
        if (matrix.getWidth() != edge || matrix.getHeight() != edge) {
            // the writer grows the matrix when the symbol needs more than one pixel per module
            throw new WriterException("Payload of " + payload.length() + " chars does not fit a "
                    + edge + " px QR code");
        }
        log.debug("QR code for {} chars rendered at {} px", payload.length(), edge);

        return MatrixToImageWriter.toBufferedImage(matrix, new MatrixToImageConfig(fg.getRGB(), bg.getRGB()));
    }

    private byte[] writePng(BufferedImage image, ImageQuality quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("png");
        if (!writers.hasNext()) {
            throw new IOException("No PNG image writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(quality.compressionQuality());
            }
            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return baos.toByteArray();
    }
}
