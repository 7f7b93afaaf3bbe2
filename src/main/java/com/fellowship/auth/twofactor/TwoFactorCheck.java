package com.fellowship.auth.twofactor;

/**
 * 二次验证要求的判定结果。
 *
 * @param required       当前用户是否开启了二次验证。
 * @param verified       是否已满足（未开启也视为满足）。
 * @param redirectTarget 未满足时的挑战页地址，含原始目标地址。
 */
public record TwoFactorCheck(boolean required, boolean verified, String redirectTarget) {

    public boolean needsChallenge() {
        return required && !verified;
    }
}
