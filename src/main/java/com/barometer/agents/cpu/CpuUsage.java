package com.barometer.agents.cpu;

/**
 * Share of CPU time spent in each state between two samples, in percent.
 */
public record CpuUsage(double user, double system, double idle, int cores) {

    public double busy() {
        return 100.0 - idle;
    }

    public static CpuUsage between(CpuSample first, CpuSample second) {
        long total = second.total() - first.total();
        if (total <= 0) {
            return new CpuUsage(0, 0, 100, second.cores());
        }
        return new CpuUsage(
                percent(second.user() + second.nice() - first.user() - first.nice(), total),
                percent(second.system() + second.irq() + second.softirq()
                        - first.system() - first.irq() - first.softirq(), total),
                percent(second.idleTotal() - first.idleTotal(), total),
                second.cores());
    }

    private static double percent(long part, long total) {
        return Math.round(part * 1000.0 / total) / 10.0;
    }
}
