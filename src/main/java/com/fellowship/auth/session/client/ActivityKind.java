package com.fellowship.auth.session.client;

/**
 * 计入用户活跃的交互类型。
 */
public enum ActivityKind {
    POINTER_MOVE,
    POINTER_DOWN,
    KEY_PRESS,
    SCROLL,
    TOUCH,
    CLICK
}
