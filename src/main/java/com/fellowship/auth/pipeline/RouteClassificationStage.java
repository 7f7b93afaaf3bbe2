package com.fellowship.auth.pipeline;

import com.fellowship.auth.route.RouteClass;
import com.fellowship.auth.route.RouteClassifier;

/**
 * 管线第三阶段：路由分类。不需要二次验证的路由在此直接放行。
 */
public class RouteClassificationStage implements PipelineStage {

    private final RouteClassifier classifier;

    public RouteClassificationStage(RouteClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public String name() {
        return "route-classification";
    }

    @Override
    public StageOutcome evaluate(RequestContext context) {
        RouteClass routeClass = classifier.classify(context.getMethod(), context.getPath());
        context.setRouteClass(routeClass);
        return routeClass == RouteClass.REQUIRES_TWO_FACTOR ? StageOutcome.proceed() : StageOutcome.skipRemaining();
    }
}
