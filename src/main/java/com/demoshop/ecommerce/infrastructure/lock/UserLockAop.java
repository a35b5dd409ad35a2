package com.demoshop.ecommerce.infrastructure.lock;

import com.demoshop.ecommerce.common.exception.ErrorCode;
import com.demoshop.ecommerce.common.exception.SystemException;
import com.demoshop.ecommerce.infrastructure.config.DemoShopProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.Ordered;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 사용자별 락 AOP 처리
 *
 * @UserLock 어노테이션이 붙은 메서드 호출 시:
 * 1. 동적 키 생성 (Spring EL 지원)
 * 2. 키에 해당하는 ReentrantLock 획득 시도 (demoshop.lock.wait-time-ms 대기)
 * 3. 메서드 실행
 * 4. finally 블록에서 Lock 해제
 *
 * 실패 처리:
 * - 대기 시간 초과 또는 인터럽트 → SystemException(LOCK_ACQUISITION_FAILED)
 */
@Aspect
@Component
@Slf4j
@RequiredArgsConstructor
@org.springframework.core.annotation.Order(Ordered.LOWEST_PRECEDENCE - 1000)
public class UserLockAop implements Ordered {

    private final LocalLockRegistry lockRegistry;
    private final DemoShopProperties properties;
    private final ExpressionParser expressionParser = new SpelExpressionParser();

    @Around("@annotation(userLock)")
    public Object around(ProceedingJoinPoint joinPoint, UserLock userLock) throws Throwable {
        String dynamicKey = generateKey(joinPoint, userLock.key());
        ReentrantLock lock = lockRegistry.getLock(dynamicKey);
        long waitTimeMs = properties.getLock().getWaitTimeMs();

        boolean lockAcquired;
        try {
            log.debug("[UserLock] 락 획득 시도 - key: {}, waitTime: {}ms", dynamicKey, waitTimeMs);
            lockAcquired = lock.tryLock(waitTimeMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[UserLock] 락 대기 중 스레드 인터럽트 - key: {}", dynamicKey, e);
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, e);
        }

        if (!lockAcquired) {
            log.warn("[UserLock] 락 획득 실패 - key: {} (waitTime 초과)", dynamicKey);
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "key=" + dynamicKey);
        }

        try {
            log.debug("[UserLock] 락 획득 성공 - key: {}", dynamicKey);
            return joinPoint.proceed();
        } finally {
            lock.unlock();
            log.debug("[UserLock] 락 해제 - key: {}", dynamicKey);
        }
    }

    /**
     * Spring EL을 사용하여 동적 키를 생성합니다.
     *
     * 예제:
     * - "'cart:' + #p0" → "cart:u1" (첫 번째 파라미터가 "u1"일 때)
     */
    private String generateKey(ProceedingJoinPoint joinPoint, String keyPattern) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Object[] args = joinPoint.getArgs();

        EvaluationContext context = new StandardEvaluationContext();
        for (int i = 0; i < args.length; i++) {
            context.setVariable("p" + i, args[i]);
        }
        context.setVariable("args", args);

        String dynamicKey = expressionParser.parseExpression(keyPattern).getValue(context, String.class);
        log.debug("[UserLock] 동적 키 생성 - method: {}, pattern: {}, result: {}",
                signature.getMethod().getName(), keyPattern, dynamicKey);
        return dynamicKey;
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE - 1000;
    }
}
