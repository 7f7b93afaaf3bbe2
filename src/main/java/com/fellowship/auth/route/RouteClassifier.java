package com.fellowship.auth.route;

import com.fellowship.auth.config.AuthProperties;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 路由分类器：请求路径到 {@link RouteClass} 的纯函数。
 * <p>
 * 豁免前缀优先于二次验证判断，保证签发 CSRF 令牌的接口与挑战页自身不会要求令牌或二次验证；
 * 前缀按路径段匹配。
 */
public class RouteClassifier {

    private static final Set<String> ASSET_METHODS = Set.of("GET", "HEAD");

    private final List<String> exemptPrefixes;
    private final List<String> staticExtensions;
    private final List<String> twoFactorPrefixes;

    public RouteClassifier(AuthProperties.Routes routes) {
        this(routes.getExemptPrefixes(), routes.getStaticExtensions(), routes.getTwoFactorPrefixes());
    }

    public RouteClassifier(List<String> exemptPrefixes, List<String> staticExtensions, List<String> twoFactorPrefixes) {
        this.exemptPrefixes = List.copyOf(exemptPrefixes);
        this.staticExtensions = staticExtensions.stream().map(ext -> ext.toLowerCase(Locale.ROOT)).toList();
        this.twoFactorPrefixes = List.copyOf(twoFactorPrefixes);
    }

    /**
     * 对路径分类，不区分请求方法。
     *
     * @param path 请求路径（不含查询串）。
     * @return 路由分类。
     */
    public RouteClass classify(String path) {
        return classify(null, path);
    }

    /**
     * 对请求分类。
     * <p>
     * 豁免前缀优先；其次是需二次验证的前缀；最后按扩展名识别静态资源，
     * 静态资源豁免只适用于 GET/HEAD（{@code method} 为 null 时视为资源读取）。
     *
     * @param method HTTP 方法，可为 null。
     * @param path   请求路径（不含查询串）。
     * @return 路由分类。
     */
    public RouteClass classify(String method, String path) {
        String normalized = path == null || path.isEmpty() ? "/" : path;
        if (exemptPrefixes.stream().anyMatch(prefix -> matchesPrefix(normalized, prefix))) {
            return RouteClass.EXEMPT;
        }
        if (twoFactorPrefixes.stream().anyMatch(prefix -> matchesPrefix(normalized, prefix))) {
            return RouteClass.REQUIRES_TWO_FACTOR;
        }
        if (isAssetRead(method) && hasStaticExtension(normalized)) {
            return RouteClass.EXEMPT;
        }
        return RouteClass.STANDARD;
    }

    public boolean requiresTwoFactor(String path) {
        return classify(path) == RouteClass.REQUIRES_TWO_FACTOR;
    }

    private boolean hasStaticExtension(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return staticExtensions.stream().anyMatch(lower::endsWith);
    }

    private static boolean isAssetRead(String method) {
        return method == null || ASSET_METHODS.contains(method.toUpperCase(Locale.ROOT));
    }

    // "/settings" 匹配 "/settings" 与 "/settings/..."，不匹配 "/settingsx"
    private static boolean matchesPrefix(String path, String prefix) {
        if (prefix.endsWith("/")) {
            return path.startsWith(prefix);
        }
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }
}
