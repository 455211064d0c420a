package org.example.flower_shop.navigation;

/**
 * Формат callback_data кнопок (максимум 64 байта, поэтому коротко).
 * <p>
 * nav:enter:&lt;screen&gt;  nav:back  nav:reset
 * build:start  build:pick:&lt;value&gt;  build:toggle:&lt;addon&gt;  build:done
 * build:back  build:finalize  build:cancel
 * cart:add:&lt;flowerId&gt;  cart:clear  cart:checkout
 * admin:flower:add  admin:flower:cancel  admin:flower:delete:&lt;flowerId&gt;
 */
public final class CallbackData {

    public static final String NAV_ENTER = "nav:enter:";
    public static final String NAV_BACK = "nav:back";
    public static final String NAV_RESET = "nav:reset";

    public static final String BUILD_START = "build:start";
    public static final String BUILD_PICK = "build:pick:";
    public static final String BUILD_TOGGLE = "build:toggle:";
    public static final String BUILD_DONE = "build:done";
    public static final String BUILD_BACK = "build:back";
    public static final String BUILD_FINALIZE = "build:finalize";
    public static final String BUILD_CANCEL = "build:cancel";

    public static final String CART_ADD = "cart:add:";
    public static final String CART_CLEAR = "cart:clear";
    public static final String CART_CHECKOUT = "cart:checkout";

    public static final String ADMIN_FLOWER_ADD = "admin:flower:add";
    public static final String ADMIN_FLOWER_CANCEL = "admin:flower:cancel";
    public static final String ADMIN_FLOWER_DELETE = "admin:flower:delete:";

    private CallbackData() {
    }

    public static String enter(String screenId) {
        return NAV_ENTER + screenId;
    }

    public static String pick(String value) {
        return BUILD_PICK + value;
    }

    public static String toggle(String addonId) {
        return BUILD_TOGGLE + addonId;
    }

    public static String addToCart(Long flowerId) {
        return CART_ADD + flowerId;
    }

    public static String deleteFlower(Long flowerId) {
        return ADMIN_FLOWER_DELETE + flowerId;
    }
}
