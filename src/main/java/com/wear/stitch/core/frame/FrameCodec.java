package com.wear.stitch.core.frame;

import com.wear.stitch.config.NativeLibraryLoader;
import com.wear.stitch.core.stitcher.StitchException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

/**
 * Frame 与 OpenCV Mat / PNG 之间的转换
 * <p>
 * 文件读写使用 Java NIO + imdecode/imencode，避免 Imgcodecs.imread/imwrite 在中文路径上的问题。
 * 拼接核心只依赖 {@link Frame}，OpenCV 只出现在这里。
 */
public final class FrameCodec {

    static {
        NativeLibraryLoader.loadNativeLibraries();
    }

    private FrameCodec() {
    }

    /**
     * native 库未加载时 OpenCV 调用会抛出 UnsatisfiedLinkError，这里提前转为 StitchException
     */
    private static void requireOpenCV() {
        if (!NativeLibraryLoader.isLoaded()) {
            throw new StitchException("OpenCV native library not available");
        }
    }

    /**
     * Mat (灰度/BGR/BGRA, 8 位或 16 位) 转为 Frame；无 alpha 通道时 alpha 为 255
     */
    public static Frame fromMat(Mat src) {
        if (src == null || src.empty()) {
            throw new IllegalArgumentException("Mat cannot be null or empty");
        }
        requireOpenCV();

        Mat eightBit = src;
        Mat bgra = new Mat();
        try {
            if (src.depth() != CvType.CV_8U) {
                eightBit = new Mat();
                double scale = src.depth() == CvType.CV_16U ? 1.0 / 257.0 : 1.0;
                src.convertTo(eightBit, CvType.CV_8U, scale);
            }

            switch (eightBit.channels()) {
                case 1 -> Imgproc.cvtColor(eightBit, bgra, Imgproc.COLOR_GRAY2BGRA);
                case 3 -> Imgproc.cvtColor(eightBit, bgra, Imgproc.COLOR_BGR2BGRA);
                case 4 -> eightBit.copyTo(bgra);
                default -> throw new IllegalArgumentException("Unsupported channel count: " + eightBit.channels());
            }

            int width = bgra.cols();
            int height = bgra.rows();
            byte[] data = new byte[width * height * 4];
            bgra.get(0, 0, data);

            int[] argb = new int[width * height];
            for (int i = 0; i < argb.length; i++) {
                int b = data[i * 4] & 0xFF;
                int g = data[i * 4 + 1] & 0xFF;
                int r = data[i * 4 + 2] & 0xFF;
                int a = data[i * 4 + 3] & 0xFF;
                argb[i] = (a << 24) | (r << 16) | (g << 8) | b;
            }
            return new Frame(width, height, argb);
        } finally {
            if (eightBit != src) {
                eightBit.release();
            }
            bgra.release();
        }
    }

    /**
     * Frame 转为 CV_8UC4 (BGRA) Mat，调用方负责释放
     */
    public static Mat toMat(Frame frame) {
        requireOpenCV();
        int width = frame.getWidth();
        int height = frame.getHeight();
        byte[] data = new byte[width * height * 4];
        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb = frame.argb(x, y);
                data[i++] = (byte) argb;
                data[i++] = (byte) (argb >> 8);
                data[i++] = (byte) (argb >> 16);
                data[i++] = (byte) (argb >>> 24);
            }
        }
        Mat mat = new Mat(height, width, CvType.CV_8UC4);
        mat.put(0, 0, data);
        return mat;
    }

    public static Frame decode(byte[] imageBytes) {
        requireOpenCV();
        MatOfByte mob = new MatOfByte(imageBytes);
        Mat mat = Imgcodecs.imdecode(mob, Imgcodecs.IMREAD_UNCHANGED);
        mob.release();
        try {
            if (mat == null || mat.empty()) {
                throw new IllegalArgumentException("Unable to decode image (" + imageBytes.length + " bytes)");
            }
            return fromMat(mat);
        } finally {
            if (mat != null) {
                mat.release();
            }
        }
    }

    public static Frame read(Path path) throws IOException {
        return decode(Files.readAllBytes(path));
    }

    public static Frame decodeBase64(String base64) {
        String payload = base64;
        int comma = payload.indexOf(',');
        if (payload.startsWith("data:") && comma > 0) {
            payload = payload.substring(comma + 1);
        }
        return decode(Base64.getDecoder().decode(payload));
    }

    public static byte[] encodePng(Frame frame) {
        Mat mat = toMat(frame);
        MatOfByte mob = new MatOfByte();
        try {
            if (!Imgcodecs.imencode(".png", mat, mob)) {
                throw new IllegalStateException("Failed to encode image to PNG");
            }
            return mob.toArray();
        } finally {
            mat.release();
            mob.release();
        }
    }

    public static void writePng(Frame frame, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, encodePng(frame));
    }

    public static String encodeBase64Png(Frame frame) {
        return Base64.getEncoder().encodeToString(encodePng(frame));
    }
}
