package org.huang.origin.registry.route;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.DeleteOptions;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.utils.Serialization;
import lombok.extern.slf4j.Slf4j;
import org.huang.origin.api.route.Route;
import org.huang.origin.api.route.RouteFields;
import org.huang.origin.api.route.RouteSpec;
import org.huang.origin.api.route.RouteStatus;
import org.huang.origin.api.route.WildcardPolicy;
import org.huang.origin.api.route.validation.DefaultRouteValidator;
import org.huang.origin.api.route.validation.RouteValidator;
import org.huang.origin.api.validation.FieldError;
import org.huang.origin.registry.errors.ErrorReporter;
import org.huang.origin.registry.errors.ErrorReporters;
import org.huang.origin.registry.errors.InternalErrorException;
import org.huang.origin.registry.errors.ResourceTypeMismatchException;
import org.huang.origin.registry.rest.LifecycleStrategy;
import org.huang.origin.registry.rest.NameGenerator;
import org.huang.origin.registry.rest.SimpleNameGenerator;
import org.huang.origin.registry.route.allocation.RouteAllocationException;
import org.huang.origin.registry.route.allocation.RouteAllocator;
import org.huang.origin.registry.route.allocation.RouterShard;
import org.huang.origin.registry.storage.FieldSelector;
import org.huang.origin.registry.storage.ResourceAttributes;
import org.huang.origin.registry.storage.SelectionPredicate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Route 的创建、更新逻辑。<br/>
 * 创建时清空 status，主机名为空且配置了分配器时生成主机名；
 * 更新时 status 保持旧值，空的 spec.host 表示不修改而不是清空。
 * 分配失败只上报给 {@link ErrorReporter}，路由仍然以空主机名创建，由外部控制器稍后补上。
 */
@Slf4j
public class RouteStrategy implements LifecycleStrategy<Route> {

    /**
     * 值为 "true" 表示主机名由系统生成
     */
    public static final String HOST_GENERATED_ANNOTATION_KEY = "openshift.io/host.generated";

    private static final ObjectMapper COPY_MAPPER = Serialization.jsonMapper().copy()
            .setSerializationInclusion(JsonInclude.Include.ALWAYS);

    /**
     * 可以为 null，此时不分配主机名
     */
    private final RouteAllocator allocator;
    private final RouteValidator validator;
    private final ErrorReporter errorReporter;
    private final NameGenerator nameGenerator;

    public RouteStrategy(RouteAllocator allocator) {
        this(allocator, DefaultRouteValidator.INSTANCE, ErrorReporters.delegatingToDefault(),
                SimpleNameGenerator.INSTANCE);
    }

    public RouteStrategy(RouteAllocator allocator, RouteValidator validator, ErrorReporter errorReporter,
                         NameGenerator nameGenerator) {
        this.allocator = allocator;
        this.validator = validator;
        this.errorReporter = errorReporter;
        this.nameGenerator = nameGenerator;
    }

    @Override
    public Class<Route> resourceType() {
        return Route.class;
    }

    @Override
    public String generateName(String base) {
        return nameGenerator.generateName(base);
    }

    @Override
    public boolean namespaceScoped() {
        return true;
    }

    @Override
    public boolean allowCreateOnUpdate() {
        return false;
    }

    @Override
    public boolean allowUnconditionalUpdate() {
        return false;
    }

    @Override
    public void prepareForCreate(Route route) {
        route.setStatus(new RouteStatus());
        if (route.getSpec() == null) {
            route.setSpec(new RouteSpec());
        }
        try {
            allocateHost(route);
        } catch (RouteAllocationException | RuntimeException e) {
            // TODO: 分配逻辑迁移到控制器之后，这里不再吞掉分配错误
            errorReporter.handleError(new InternalErrorException(
                    "allocation error: " + e.getMessage() + " for route: " + route, e));
        }
    }

    @Override
    public void prepareForUpdate(Route route, Route old) {
        route.setStatus(deepCopy(old.getStatus(), RouteStatus.class));
        if (route.getSpec() == null) {
            route.setSpec(new RouteSpec());
        }
        // 忽略清空 spec.host 的请求，用创建时的同一份定义 apply 不会报 immutable 错误
        String host = route.getSpec().getHost();
        if ((host == null || host.isEmpty()) && old.getSpec() != null) {
            route.getSpec().setHost(old.getSpec().getHost());
        }
    }

    /**
     * 只有通配策略不是 Subdomain、主机名为空并且配置了分配器时才分配主机名。
     * 先分配分片，分片失败直接抛出。
     */
    void allocateHost(Route route) throws RouteAllocationException {
        RouteSpec spec = route.getSpec();
        if (spec.getWildcardPolicy() == WildcardPolicy.SUBDOMAIN) {
            return;
        }
        if ((spec.getHost() == null || spec.getHost().isEmpty()) && allocator != null) {
            RouterShard shard = allocator.allocateRouterShard(route);
            spec.setHost(allocator.generateHostname(route, shard));

            ObjectMeta meta = route.getMetadata();
            if (meta.getAnnotations() == null) {
                meta.setAnnotations(new LinkedHashMap<>());
            }
            meta.getAnnotations().put(HOST_GENERATED_ANNOTATION_KEY, "true");
            log.debug("generated host {} for route {}/{}", spec.getHost(), meta.getNamespace(), meta.getName());
        }
    }

    @Override
    public List<FieldError> validate(Route route) {
        return validator.validateRoute(route);
    }

    @Override
    public List<FieldError> validateUpdate(Route route, Route old) {
        return validator.validateRouteUpdate(route, old);
    }

    @Override
    public void canonicalize(Route route) {
    }

    @Override
    public boolean checkGracefulDelete(Route route, DeleteOptions options) {
        return false;
    }

    public boolean hasAllocator() {
        return allocator != null;
    }

    RouteValidator getValidator() {
        return validator;
    }

    /**
     * 返回 Route 的标签和可筛选字段
     *
     * @throws ResourceTypeMismatchException obj 不是 Route
     */
    public static ResourceAttributes getAttrs(HasMetadata obj) {
        if (!(obj instanceof Route)) {
            throw new ResourceTypeMismatchException("not a route");
        }
        Route route = (Route) obj;
        Map<String, String> labels = route.getMetadata().getLabels();
        return ResourceAttributes.of(labels, RouteFields.toSelectableFields(route));
    }

    public static SelectionPredicate matcher(LabelSelector label, FieldSelector field) {
        return new SelectionPredicate(label, field, RouteStrategy::getAttrs);
    }

    /**
     * 经过一次 JSON 序列化复制，新旧对象之间不共享可变的嵌套对象。
     * null 字段也要写出，否则反序列化时会被字段默认值（空列表）替换
     */
    static <T> T deepCopy(T value, Class<T> type) {
        if (value == null) {
            return null;
        }
        try {
            return COPY_MAPPER.readValue(COPY_MAPPER.writeValueAsString(value), type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to copy " + type.getSimpleName(), e);
        }
    }
}
