package io.github.samzhu.billing.service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;

import com.tdunning.math.stats.TDigest;

import io.github.samzhu.billing.config.BillingProperties;

/**
 * 供應商抓取延遲的 T-Digest 百分位計算服務。
 *
 * <p>每個供應商維護一個記憶體內的 T-Digest，記錄每次 {@code fetchPricing} 的耗時，
 * 用於供應商狀態頁面顯示 P50/P90/P95/P99。
 * T-Digest 是一種串流式近似演算法，記憶體用量固定，尾部精度高。
 *
 * @see <a href="https://github.com/tdunning/t-digest">T-Digest GitHub</a>
 */
@Service
public class FetchLatencyService {

    private final int compression;
    private final Map<String, TDigest> digests = new ConcurrentHashMap<>();

    public FetchLatencyService(BillingProperties properties) {
        this.compression = properties.latency().digestCompression();
    }

    /**
     * 建立新的 T-Digest 實例。
     */
    public TDigest createDigest() {
        return TDigest.createMergingDigest(compression);
    }

    /**
     * 記錄一次抓取耗時。
     *
     * @param providerId 供應商 ID
     * @param latencyMs 耗時（毫秒）
     */
    public void record(String providerId, long latencyMs) {
        TDigest digest = digests.computeIfAbsent(providerId, id -> createDigest());
        // MergingDigest 不是執行緒安全的
        synchronized (digest) {
            digest.add(Math.max(0, latencyMs));
        }
    }

    /**
     * 取得供應商的延遲統計，沒有樣本時回傳空統計。
     */
    public LatencyStats stats(String providerId) {
        TDigest digest = digests.get(providerId);
        if (digest == null) {
            return LatencyStats.empty();
        }
        synchronized (digest) {
            return calculateStats(digest);
        }
    }

    /**
     * 從 T-Digest 計算延遲統計資料。
     *
     * @param digest T-Digest 實例
     * @return 包含各百分位數的統計資料
     */
    LatencyStats calculateStats(TDigest digest) {
        if (digest.size() == 0) {
            return LatencyStats.empty();
        }

        long count = digest.size();
        long min = (long) digest.getMin();
        long max = (long) digest.getMax();

        // 計算平均值（使用 centroids 的加權平均）
        double sum = 0;
        for (var centroid : digest.centroids()) {
            sum += centroid.mean() * centroid.count();
        }
        double avg = sum / count;

        return new LatencyStats(
            count,
            min,
            max,
            avg,
            digest.quantile(0.5),   // P50
            digest.quantile(0.9),   // P90
            digest.quantile(0.95),  // P95
            digest.quantile(0.99)   // P99
        );
    }

    /**
     * 延遲統計資料記錄。
     *
     * @param count 樣本數量
     * @param minMs 最小延遲 (毫秒)
     * @param maxMs 最大延遲 (毫秒)
     * @param avgMs 平均延遲 (毫秒)
     * @param p50Ms P50 延遲 (毫秒)
     * @param p90Ms P90 延遲 (毫秒)
     * @param p95Ms P95 延遲 (毫秒)
     * @param p99Ms P99 延遲 (毫秒)
     */
    public record LatencyStats(
        long count,
        long minMs,
        long maxMs,
        double avgMs,
        double p50Ms,
        double p90Ms,
        double p95Ms,
        double p99Ms
    ) {
        /**
         * 建立空的延遲統計資料。
         */
        public static LatencyStats empty() {
            return new LatencyStats(0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0);
        }

        public boolean isEmpty() {
            return count == 0;
        }
    }
}
