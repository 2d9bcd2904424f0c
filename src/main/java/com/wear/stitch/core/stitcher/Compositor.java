package com.wear.stitch.core.stitcher;

import com.wear.stitch.core.frame.Canvas;
import com.wear.stitch.core.frame.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.IntStream;

/**
 * 逐像素合成
 * <p>
 * 每个输出像素的取值规则：
 * <ol>
 *   <li>屏内来源中取源行最接近帧垂直中心的一个（距离相同取先出现的）；</li>
 *   <li>没有屏内来源且位于内部区域 [H/2, outputHeight - H/2)：复制画布上 (x, y-2) 的像素；</li>
 *   <li>顶部/底部边缘：开启透明时为 (0,0,0,0)，否则取最接近中心的屏外来源；</li>
 *   <li>完全没有来源：透明，并计入空洞数。</li>
 * </ol>
 * 规则 2 读取前面的行，所以行必须按 y 递增顺序合成；同一行内各列互不依赖。
 */
public class Compositor {
    private static final Logger logger = LoggerFactory.getLogger(Compositor.class);

    public CompositeResult composite(List<Frame> frames, ContributionMap contributions, CompositeOptions options) {
        if (frames.isEmpty()) {
            throw new FrameInputException("No frames to composite");
        }

        int width = frames.get(0).getWidth();
        double halfHeight = frames.get(0).getHeight() / 2.0;
        int outputHeight = contributions.rowCount();

        Canvas canvas = new Canvas(width, outputHeight);
        LongAdder gaps = new LongAdder();

        for (int y = 0; y < outputHeight; y++) {
            List<Contribution> rowContributions = contributions.get(y);
            Sample[] samples = new Sample[rowContributions.size()];
            for (int i = 0; i < samples.length; i++) {
                Contribution c = rowContributions.get(i);
                samples[i] = new Sample(sourceFrame(frames, c, y), c.getSourceRow());
            }

            int row = y;
            boolean interior = y >= halfHeight && y < outputHeight - halfHeight && y >= 2;

            IntStream columns = IntStream.range(0, width);
            if (options.isParallel()) {
                columns = columns.parallel();
            }
            columns.forEach(x -> canvas.set(x, row, resolve(canvas, samples, x, row, interior, options, gaps)));
        }

        long gapPixels = gaps.sum();
        if (gapPixels > 0) {
            logger.warn("{} pixel(s) had no source sample and were left transparent", gapPixels);
        }
        return new CompositeResult(canvas, gapPixels);
    }

    private static Frame sourceFrame(List<Frame> frames, Contribution c, int y) {
        if (c.getFrameIndex() < 0 || c.getFrameIndex() >= frames.size()) {
            throw new FrameInputException("Row " + y + " references frame " + c.getFrameIndex()
                    + " but only " + frames.size() + " frame(s) were given");
        }
        Frame frame = frames.get(c.getFrameIndex());
        if (c.getSourceRow() < 0 || c.getSourceRow() >= frame.getHeight()) {
            throw new FrameInputException("Row " + y + " references row " + c.getSourceRow()
                    + " of frame " + c.getFrameIndex() + " with height " + frame.getHeight());
        }
        return frame;
    }

    private static int resolve(Canvas canvas, Sample[] samples, int x, int y, boolean interior,
                               CompositeOptions options, LongAdder gaps) {
        Sample onScreen = null;
        Sample offScreen = null;
        for (Sample sample : samples) {
            if (!options.isCircularMask() || sample.isOnScreen(x)) {
                if (onScreen == null || sample.distance < onScreen.distance) {
                    onScreen = sample;
                }
            } else if (offScreen == null || sample.distance < offScreen.distance) {
                offScreen = sample;
            }
        }

        if (onScreen != null) {
            return onScreen.frame.argb(x, onScreen.row);
        }
        if (interior) {
            return canvas.get(x, y - 2);
        }
        if (offScreen == null) {
            gaps.increment();
            return Canvas.TRANSPARENT;
        }
        if (options.isTransparency()) {
            return Canvas.TRANSPARENT;
        }
        return offScreen.frame.argb(x, offScreen.row);
    }

    /**
     * 某一来源行及其在源帧中的几何信息
     */
    private static final class Sample {
        final Frame frame;
        final int row;
        final double mid;
        final double radiusSquared;
        final double distance;

        Sample(Frame frame, int row) {
            this.frame = frame;
            this.row = row;
            int height = frame.getHeight();
            this.mid = (height - 1) / 2.0;
            double radius = height / 2.0 - 2;
            this.radiusSquared = radius * radius;
            this.distance = Math.abs(row - mid);
        }

        /**
         * 点 (x, row) 是否落在源帧内切圆内
         */
        boolean isOnScreen(int x) {
            double dx = x - mid;
            double dy = row - mid;
            return dx * dx + dy * dy < radiusSquared;
        }
    }
}
