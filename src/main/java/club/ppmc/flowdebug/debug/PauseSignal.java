/**
 * PauseSignal.java
 *
 * 暂停/继续信号。单槽、电平触发：set() 表示"放行"，clear() 表示"阻塞"。
 * 信号已处于放行状态时 set() 无效果；await() 在信号已放行时立即返回。
 * 初始状态为放行。
 */
package club.ppmc.flowdebug.debug;

import java.util.concurrent.TimeUnit;

public class PauseSignal {

    private boolean set = true;

    public synchronized void set() {
        if (!set) {
            set = true;
            notifyAll();
        }
    }

    public synchronized void clear() {
        set = false;
    }

    public synchronized boolean isSet() {
        return set;
    }

    /**
     * 阻塞直到信号被放行。
     */
    public synchronized void await() throws InterruptedException {
        while (!set) {
            wait();
        }
    }

    /**
     * 最多等待给定时间。
     *
     * @return 信号已放行时为 true，超时为 false。
     */
    public synchronized boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (!set) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0L) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return true;
    }
}
