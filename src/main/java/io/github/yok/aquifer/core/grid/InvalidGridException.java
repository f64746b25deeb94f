package io.github.yok.aquifer.core.grid;

/**
 * 格子設定（領域長 L、セル数 N）が不正な場合に発生する例外です。
 */
public class InvalidGridException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public InvalidGridException(String message) {
        super(message);
    }
}
