package org.Aayush.tempus.state;

/**
 * The start of a ground action or the end of a running one.
 *
 * @param pending the running instance for {@link Kind#END}, null for starts.
 */
public record Happening(Kind kind, GroundAction action, PendingEffect pending) {

    public enum Kind {
        START,
        END
    }

    public static Happening start(GroundAction action) {
        return new Happening(Kind.START, action, null);
    }

    public static Happening end(GroundAction action, PendingEffect pending) {
        return new Happening(Kind.END, action, pending);
    }

    public boolean isStart() {
        return kind == Kind.START;
    }

    @Override
    public String toString() {
        return (kind == Kind.START ? "start " : "end ") + action.signature();
    }
}
