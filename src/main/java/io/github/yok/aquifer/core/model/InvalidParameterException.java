package io.github.yok.aquifer.core.model;

/**
 * 物理パラメータ（反応速度定数・半飽和定数・流速・空隙率など）が不正な場合に発生する例外です。
 */
public class InvalidParameterException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public InvalidParameterException(String message) {
        super(message);
    }
}
