package io.github.samzhu.billing.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 金額計算工具類。
 *
 * <p>系統內所有金額以 USD 為單位、scale 6（百萬分之一美元）表示，
 * 全程使用 {@link BigDecimal}，不經過浮點數。
 */
public final class MoneyUtils {

    /** 金額小數位數 */
    public static final int SCALE = 6;

    /** 最小計費單位 0.000001 */
    public static final BigDecimal MINIMUM_UNIT = BigDecimal.ONE.movePointLeft(SCALE);

    /** 變動百分比小數位數 */
    public static final int PERCENT_SCALE = 4;

    private static final BigDecimal ONE_THOUSAND = new BigDecimal("1000");
    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private MoneyUtils() {
        // 工具類不允許實例化
    }

    /**
     * 四捨五入到 6 位小數。
     *
     * @param value 原始金額
     * @return scale 6 的金額
     */
    public static BigDecimal round6(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 將金額正規化為 scale 6，不允許捨入。
     *
     * @param value 原始金額
     * @return scale 6 的金額
     * @throws ArithmeticException 若小數位數超過 6 且無法無損轉換
     */
    public static BigDecimal toMoney(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    /**
     * 計算 token 成本（未捨入）。
     *
     * <pre>
     * 成本 = tokens × pricePer1k / 1000
     * </pre>
     */
    public static BigDecimal tokenCost(long tokens, BigDecimal pricePer1k) {
        if (tokens <= 0 || pricePer1k == null) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(tokens)
            .multiply(pricePer1k)
            .divide(ONE_THOUSAND);
    }

    /**
     * 計算價格變動百分比。
     *
     * <pre>
     * changePercent = (newValue - oldValue) / oldValue × 100
     * </pre>
     *
     * <p>舊價格為 0 時視為 100% 變動。
     *
     * @return 變動百分比，scale 4
     */
    public static BigDecimal changePercent(BigDecimal oldValue, BigDecimal newValue) {
        if (oldValue.signum() == 0) {
            return ONE_HUNDRED.setScale(PERCENT_SCALE);
        }
        return newValue.subtract(oldValue)
            .multiply(ONE_HUNDRED)
            .divide(oldValue, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
