package com.fellowship.auth.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 携带动态码或备用码的请求。
 */
public record TwoFactorCodeRequest(
        @NotBlank(message = "验证码不能为空")
        @Size(max = 16, message = "验证码格式错误")
        String code
) {
}
