package dev.pekelund.receiptscan.recognizer.image;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * {@link ReceiptImageInspector} backed by {@code javax.imageio}.
 */
public class ImageIoReceiptImageInspector implements ReceiptImageInspector {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImageIoReceiptImageInspector.class);

    public static final long DEFAULT_MAX_BYTES = 10L * 1024 * 1024;
    public static final int DEFAULT_MAX_DIMENSION = 2048;

    private static final Set<String> SUPPORTED_FORMATS = Set.of("jpeg", "png", "gif", "bmp");
    private static final int MIN_WIDTH = 800;
    private static final int MIN_HEIGHT = 600;
    // Decoding allocates a raster of width x height pixels
    private static final long MAX_PIXELS = 50_000_000L;
    private static final long LARGE_IMAGE_BYTES = 5L * 1024 * 1024;
    private static final long HIGH_QUALITY_ENCODING_LIMIT = 2L * 1024 * 1024;
    private static final int CONTRAST_SAMPLES_PER_SIDE = 200;

    private final long maxBytes;
    private final int maxDimension;

    public ImageIoReceiptImageInspector() {
        this(DEFAULT_MAX_BYTES, DEFAULT_MAX_DIMENSION);
    }

    public ImageIoReceiptImageInspector(long maxBytes, int maxDimension) {
        this.maxBytes = maxBytes;
        this.maxDimension = maxDimension;
    }

    @Override
    public ImageValidation validate(ReceiptImage image) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (image == null || image.isEmpty()) {
            errors.add("Image is empty");
            return new ImageValidation(false, errors, warnings);
        }
        if (image.sizeBytes() > maxBytes) {
            errors.add(String.format("Image is %d bytes; the limit is %d bytes", image.sizeBytes(), maxBytes));
        }
        if (StringUtils.hasText(image.contentType()) && !image.contentType().toLowerCase(Locale.ROOT).startsWith("image/")) {
            warnings.add("Content type '" + image.contentType() + "' is not an image type");
        }
        try {
            Header header = header(image);
            if (!SUPPORTED_FORMATS.contains(header.format())) {
                errors.add("Unsupported image format: " + header.format());
            }
            if ((long) header.width() * header.height() > MAX_PIXELS) {
                errors.add(String.format("Image is %dx%d; the limit is %d pixels", header.width(), header.height(),
                    MAX_PIXELS));
            } else if (header.width() < MIN_WIDTH || header.height() < MIN_HEIGHT) {
                warnings.add(String.format("Low resolution (%dx%d); text may be hard to read",
                    header.width(), header.height()));
            }
        } catch (ReceiptImageException ex) {
            errors.add(ex.getMessage());
        }
        if (image.sizeBytes() > LARGE_IMAGE_BYTES) {
            warnings.add("Large image; upload and recognition will be slower");
        }
        if (!errors.isEmpty()) {
            LOGGER.info("Image '{}' failed validation: {}", image.fileName(), errors);
        }
        return new ImageValidation(errors.isEmpty(), errors, warnings);
    }

    @Override
    public ImageQualityAnalysis analyzeQuality(ReceiptImage image) {
        List<String> issues = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        Decoded decoded;
        try {
            decoded = decode(image);
        } catch (ReceiptImageException ex) {
            LOGGER.warn("Could not read dimensions of '{}': {}", image.fileName(), ex.getMessage());
            issues.add("Image dimensions could not be read");
            suggestions.add("Upload a standard JPEG or PNG photo of the receipt");
            return new ImageQualityAnalysis(QualityGrade.fromScore(50), 50, issues, suggestions,
                new ImageMetadata(0, 0, "unknown", image.sizeBytes()));
        }

        BufferedImage pixels = decoded.image();
        int width = pixels.getWidth();
        int height = pixels.getHeight();
        long pixelCount = (long) width * height;
        int score = 100;

        if (width < MIN_WIDTH || height < MIN_HEIGHT) {
            score -= 20;
            issues.add(String.format("Low resolution (%dx%d)", width, height));
            suggestions.add("Move closer to the receipt or use a higher camera resolution");
        }
        double bytesPerPixel = (double) image.sizeBytes() / pixelCount;
        if (bytesPerPixel < 0.5) {
            score -= 15;
            issues.add("Heavy compression");
            suggestions.add("Use a higher image quality setting on the camera");
        }
        if ("jpeg".equals(decoded.format()) && bytesPerPixel * 8 < 1.0) {
            score -= 5;
            issues.add("Low JPEG quality");
        }
        if (pixels.getColorModel().getNumColorComponents() == 1) {
            score += 5;
        }
        double contrast = luminanceStandardDeviation(pixels);
        if (contrast < 30) {
            score -= 15;
            issues.add("Low contrast");
            suggestions.add("Photograph the receipt in even, bright lighting");
        } else if (contrast > 80) {
            score += 5;
        }

        score = Math.max(0, Math.min(100, score));
        QualityGrade grade = QualityGrade.fromScore(score);
        LOGGER.debug("Quality of '{}': {} ({}), issues: {}", image.fileName(), grade, score, issues);
        return new ImageQualityAnalysis(grade, score, issues, suggestions,
            new ImageMetadata(width, height, decoded.format(), image.sizeBytes()));
    }

    @Override
    public PreprocessedImage preprocess(ReceiptImage image) {
        BufferedImage source = decode(image).image();
        double scale = Math.min(1.0, (double) maxDimension / Math.max(source.getWidth(), source.getHeight()));
        int width = Math.max(1, (int) Math.round(source.getWidth() * scale));
        int height = Math.max(1, (int) Math.round(source.getHeight() * scale));

        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = target.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, width, height);
            graphics.drawImage(source, 0, 0, width, height, null);
        } finally {
            graphics.dispose();
        }

        float quality = image.sizeBytes() <= HIGH_QUALITY_ENCODING_LIMIT ? 0.95f : 0.85f;
        byte[] encoded = encodeJpeg(target, quality);
        LOGGER.debug("Preprocessed '{}' from {}x{} to {}x{} ({} -> {} bytes)", image.fileName(), source.getWidth(),
            source.getHeight(), width, height, image.sizeBytes(), encoded.length);
        return new PreprocessedImage(encoded, "image/jpeg", width, height, image.sizeBytes());
    }

    private static Decoded decode(ReceiptImage image) {
        return read(image, (reader, format) -> new Decoded(reader.read(0), format));
    }

    /**
     * Reads format and dimensions from the image header without decoding pixels.
     */
    private static Header header(ReceiptImage image) {
        return read(image, (reader, format) -> new Header(format, reader.getWidth(0), reader.getHeight(0)));
    }

    private static <T> T read(ReceiptImage image, ReaderCallback<T> callback) {
        ImageReader reader = null;
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(image.content()))) {
            Iterator<ImageReader> readers = input != null ? ImageIO.getImageReaders(input) : null;
            if (readers == null || !readers.hasNext()) {
                throw new ReceiptImageException("Unrecognised image format");
            }
            reader = readers.next();
            reader.setInput(input);
            return callback.apply(reader, normaliseFormat(reader.getFormatName()));
        } catch (IOException ex) {
            throw new ReceiptImageException("Image could not be decoded", ex);
        } catch (ReceiptImageException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            // Decoders signal corrupt or oversized data with unchecked exceptions as well
            throw new ReceiptImageException("Image could not be decoded", ex);
        } finally {
            if (reader != null) {
                reader.dispose();
            }
        }
    }

    private static byte[] encodeJpeg(BufferedImage image, float quality) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new ReceiptImageException("No JPEG encoder available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ImageOutputStream output = ImageIO.createImageOutputStream(buffer)) {
            writer.setOutput(output);
            ImageWriteParam params = writer.getDefaultWriteParam();
            params.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            params.setCompressionQuality(quality);
            writer.write(null, new IIOImage(image, null, null), params);
        } catch (IOException ex) {
            throw new ReceiptImageException("Image could not be encoded as JPEG", ex);
        } finally {
            writer.dispose();
        }
        return buffer.toByteArray();
    }

    private static double luminanceStandardDeviation(BufferedImage image) {
        int stepX = Math.max(1, image.getWidth() / CONTRAST_SAMPLES_PER_SIDE);
        int stepY = Math.max(1, image.getHeight() / CONTRAST_SAMPLES_PER_SIDE);
        double sum = 0;
        double sumOfSquares = 0;
        long count = 0;
        for (int y = 0; y < image.getHeight(); y += stepY) {
            for (int x = 0; x < image.getWidth(); x += stepX) {
                int rgb = image.getRGB(x, y);
                double luminance = 0.299 * ((rgb >> 16) & 0xFF) + 0.587 * ((rgb >> 8) & 0xFF) + 0.114 * (rgb & 0xFF);
                sum += luminance;
                sumOfSquares += luminance * luminance;
                count++;
            }
        }
        if (count == 0) {
            return 0;
        }
        double mean = sum / count;
        return Math.sqrt(Math.max(0, sumOfSquares / count - mean * mean));
    }

    private static String normaliseFormat(String formatName) {
        String format = formatName != null ? formatName.toLowerCase(Locale.ROOT) : "unknown";
        return "jpg".equals(format) ? "jpeg" : format;
    }

    private record Decoded(BufferedImage image, String format) {
    }

    private record Header(String format, int width, int height) {
    }

    @FunctionalInterface
    private interface ReaderCallback<T> {

        T apply(ImageReader reader, String format) throws IOException;
    }
}
