package com.tablehub.gameservice.games.pvp.domain.constants;

/**
 * 多人房间相关的提示消息
 */
public final class RoomMessages {

    private RoomMessages() {
        // 工具类，禁止实例化
    }

    /** 未命名房间的默认名 */
    public static final String DEFAULT_ROOM_NAME = "Room";

    // ========== 认证 / 授权 ==========

    public static final String TOKEN_MISSING = "缺少房间令牌";

    public static final String TOKEN_INVALID = "房间令牌无效或已失效";

    public static final String TOKEN_OTHER_ROOM = "令牌不属于该房间";

    /** 令牌校验通过后，等锁期间座位已易主或令牌已被吊销 */
    public static final String SEAT_LOST = "座位已不属于该令牌，请重新加入房间";

    public static final String HOST_ONLY = "只有房主可以执行该操作";

    public static final String SPECTATOR_CANNOT_ACT = "观战者不能行动";

    /** 声明的行动方与令牌座位不一致 */
    public static final String NOT_YOUR_SEAT = "只能以自己的座位（%s）行动";

    public static final String NOT_YOUR_TURN = "未轮到该方行动（当前应为 %s）";

    public static final String NOT_PENDING_RESPONDER = "该座位无需响应当前报价";

    // ========== 房间状态 ==========

    public static final String ROOM_NOT_FOUND = "房间不存在: %s";

    public static final String USER_NAME_REQUIRED = "userName 不能为空";

    public static final String ROOM_NOT_STARTED = "房间尚未开局";

    public static final String ROOM_ALREADY_STARTED = "房间已开局";

    public static final String CANNOT_LEAVE_IN_GAME = "对局进行中，入座玩家不能离开";

    public static final String NOT_ENOUGH_PLAYERS = "至少需要 %d 名玩家入座才能开局";

    public static final String STALE_VERSION = "状态版本已过期（期望 %d，当前 %d），请刷新后重试";

    public static String format(String template, Object... args) {
        return String.format(template, args);
    }
}
