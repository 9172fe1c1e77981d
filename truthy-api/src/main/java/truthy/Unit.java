package truthy;

/**
 * 无值类型，恒为假
 */
public final class Unit implements Truthy {

    /** 唯一实例 */
    public static final Unit INSTANCE = new Unit();

    private Unit() {
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public String toString() {
        return "Unit";
    }
}
