package org.tapeshift.converter.backend.primitives;

/**
 * Labels of the control states synthesized by the converter.
 * <p>
 * Per-target labels are built by prepending a role prefix to a renamed source label.
 * Source labels always start with the simulation prefix or the terminal prefix, and none
 * of the role prefixes below does, so generated labels are unique.
 */
public final class ControlStates {

    // Infinite -> Sipser setup
    public static final String SETUP_CARRY_0 = "q_carry_0";
    public static final String SETUP_CARRY_1 = "q_carry_1";
    public static final String SETUP_WRITE_END_MARKER = "q_write_end_marker";
    public static final String SETUP_PAD_EMPTY = "q_pad_empty";
    public static final String SETUP_RETURN_HEAD = "q_return_head";

    // Sipser -> Infinite setup
    public static final String SETUP_WRITE_WALL = "q_write_wall";

    private ControlStates() {}

    public static String checkRight(String state) {
        return "check_right_" + state;
    }

    public static String expandRight(String state) {
        return "expand_right_" + state;
    }

    public static String checkLeft(String state) {
        return "check_left_" + state;
    }

    public static String shiftStart(String state) {
        return "shift_start_" + state;
    }

    public static String shiftCarry0(String state) {
        return "shift_carry_0_" + state;
    }

    public static String shiftCarry1(String state) {
        return "shift_carry_1_" + state;
    }

    public static String shiftCarryBlank(String state) {
        return "shift_carry_blank_" + state;
    }

    public static String shiftWriteEnd(String state) {
        return "shift_write_end_" + state;
    }

    public static String shiftReturn(String state) {
        return "shift_return_" + state;
    }

    public static String checkLeftWall(String state) {
        return "check_left_wall_" + state;
    }
}
