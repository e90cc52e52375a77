package org.be.trackerservice.service.detection;

/**
 * 버킷 수의 평균과 표본 표준편차. 값이 2개 미만이면 표준편차는 0.
 */
public final class SeriesStatistics {

    private final int size;
    private final double mean;
    private final double sampleStdDev;

    private SeriesStatistics(int size, double mean, double sampleStdDev) {
        this.size = size;
        this.mean = mean;
        this.sampleStdDev = sampleStdDev;
    }

    public static SeriesStatistics of(long[] values) {
        if (values.length == 0) {
            return new SeriesStatistics(0, 0.0, 0.0);
        }

        double sum = 0;
        for (long value : values) {
            sum += value;
        }
        double mean = sum / values.length;

        if (values.length < 2) {
            return new SeriesStatistics(values.length, mean, 0.0);
        }

        double sumSquaredDiff = 0;
        for (long value : values) {
            double diff = value - mean;
            sumSquaredDiff += diff * diff;
        }
        return new SeriesStatistics(values.length, mean, Math.sqrt(sumSquaredDiff / (values.length - 1)));
    }

    public int getSize() {
        return size;
    }

    public double getMean() {
        return mean;
    }

    public double getSampleStdDev() {
        return sampleStdDev;
    }

    public double threshold(double sigma) {
        return mean + sigma * sampleStdDev;
    }

    /**
     * 평균 대비 편차 (%), 평균이 0 이면 0
     */
    public double percentageDeviation(long count) {
        return mean > 0 ? (count - mean) / mean * 100.0 : 0.0;
    }
}
