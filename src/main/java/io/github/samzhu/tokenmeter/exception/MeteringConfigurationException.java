package io.github.samzhu.tokenmeter.exception;

/**
 * 計量設定錯誤。
 *
 * <p>目前只在找不到可用的 Free 方案時拋出。這是部署問題而非用戶問題，
 * API 層回傳 500 與通用訊息，詳細原因只寫入日誌。
 */
public class MeteringConfigurationException extends RuntimeException {

    public MeteringConfigurationException(String message) {
        super(message);
    }
}
