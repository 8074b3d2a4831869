package com.shardrouter.adapter.in.aop;

import com.shardrouter.application.port.in.RoutingScopeUseCase;
import com.shardrouter.application.port.in.RoutingScopeUseCase.RoutingScope;
import com.shardrouter.domain.model.ForcedTarget;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.support.AopUtils;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.AnnotationTransactionAttributeSource;
import org.springframework.transaction.interceptor.TransactionAttribute;
import org.springframework.transaction.interceptor.TransactionAttributeSource;

import java.lang.reflect.Method;

/**
 * Opens routing scopes around annotated Spring beans.
 *
 * Runs before the transaction interceptor, so the transaction scope is already in place
 * when the transaction manager asks the routed DataSource for its connection.
 */
@Aspect
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RoutingScopeAspect {

    private static final Logger log = LoggerFactory.getLogger(RoutingScopeAspect.class);

    private final RoutingScopeUseCase routingScopes;
    private final TransactionAttributeSource transactionAttributes = new AnnotationTransactionAttributeSource();

    public RoutingScopeAspect(RoutingScopeUseCase routingScopes) {
        this.routingScopes = routingScopes;
    }

    @Around("@annotation(org.springframework.transaction.annotation.Transactional)"
        + " || @within(org.springframework.transaction.annotation.Transactional)")
    public Object inTransaction(ProceedingJoinPoint joinPoint) throws Throwable {
        if (!opensTransaction(joinPoint)) {
            return joinPoint.proceed();
        }
        return proceedWithin(routingScopes.enterTransaction(), joinPoint);
    }

    @Around("@annotation(com.shardrouter.adapter.in.aop.SchemaMigration)"
        + " || @within(com.shardrouter.adapter.in.aop.SchemaMigration)")
    public Object inMigration(ProceedingJoinPoint joinPoint) throws Throwable {
        return proceedWithin(routingScopes.enterMigration(), joinPoint);
    }

    @Around("@annotation(com.shardrouter.adapter.in.aop.OnReplica)"
        + " || @within(com.shardrouter.adapter.in.aop.OnReplica)")
    public Object onReplica(ProceedingJoinPoint joinPoint) throws Throwable {
        return proceedWithin(routingScopes.enterForced(ForcedTarget.REPLICA), joinPoint);
    }

    @Around("@annotation(com.shardrouter.adapter.in.aop.OnPrimary)"
        + " || @within(com.shardrouter.adapter.in.aop.OnPrimary)")
    public Object onPrimary(ProceedingJoinPoint joinPoint) throws Throwable {
        return proceedWithin(routingScopes.enterForced(ForcedTarget.PRIMARY), joinPoint);
    }

    /**
     * False for NOT_SUPPORTED and NEVER, which run the method without a transaction.
     * Method-level attributes override type-level ones.
     */
    private boolean opensTransaction(ProceedingJoinPoint joinPoint) {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        Class<?> targetClass = AopUtils.getTargetClass(joinPoint.getTarget());
        TransactionAttribute attribute = transactionAttributes.getTransactionAttribute(method, targetClass);
        if (attribute == null) {
            return true;
        }
        int propagation = attribute.getPropagationBehavior();
        return propagation != TransactionDefinition.PROPAGATION_NOT_SUPPORTED
            && propagation != TransactionDefinition.PROPAGATION_NEVER;
    }

    private Object proceedWithin(RoutingScope scope, ProceedingJoinPoint joinPoint) throws Throwable {
        try (scope) {
            log.trace("Routing scope opened for {}", joinPoint.getSignature().toShortString());
            return joinPoint.proceed();
        }
    }
}
