/**
 * 観測値が矛盾していて, 知識ベースの不変条件が破れたことを表す.
 * 例: 文の地雷数が 0 未満 / セル数超過, 同じセルが安全かつ地雷.
 */
public class InconsistentKnowledgeException extends IllegalStateException {

    public InconsistentKnowledgeException(String message) {
        super(message);
    }
}
