package com.linkscout.core.crawler.robots;

/** robots 캐시 만료 판단용 시계. 테스트에서 고정 시각 주입 */
@FunctionalInterface
public interface RobotsClock {
    long nowMillis();

    RobotsClock SYSTEM = System::currentTimeMillis;
}
