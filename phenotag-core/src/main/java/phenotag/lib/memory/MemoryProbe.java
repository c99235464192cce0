/*-
 * #%L
 * This file is part of PhenoTag.
 * %%
 * Copyright (C) 2024 - 2025 PhenoTag developers
 * %%
 * PhenoTag is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * PhenoTag is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with PhenoTag.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package phenotag.lib.memory;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

import phenotag.lib.common.GeneralTools;

/**
 * Source of memory readings.
 * <p>
 * The default implementation uses the platform MXBeans; other implementations can be used to 
 * simulate memory conditions.
 * 
 * @author PhenoTag developers
 */
@FunctionalInterface
public interface MemoryProbe {
	
	/**
	 * Read the current memory usage.
	 * @return
	 * @throws TelemetryUnavailableException if memory usage cannot be determined
	 */
	MemorySample read() throws TelemetryUnavailableException;
	
	/**
	 * Get a probe that reads memory from the JVM and host operating system.
	 * @return
	 */
	static MemoryProbe system() {
		return SystemMemoryProbe.INSTANCE;
	}
	
	
	/**
	 * Probe backed by {@link ManagementFactory}.
	 */
	class SystemMemoryProbe implements MemoryProbe {
		
		private static final SystemMemoryProbe INSTANCE = new SystemMemoryProbe();
		
		private SystemMemoryProbe() {}

		@Override
		public MemorySample read() throws TelemetryUnavailableException {
			OperatingSystemMXBean os;
			try {
				os = ManagementFactory.getOperatingSystemMXBean();
			} catch (RuntimeException e) {
				throw new TelemetryUnavailableException("Operating system MXBean not available", e);
			}
			if (!(os instanceof com.sun.management.OperatingSystemMXBean))
				throw new TelemetryUnavailableException("Physical memory information not supported by " + os.getClass().getName());
			var osBean = (com.sun.management.OperatingSystemMXBean)os;
			long total = osBean.getTotalMemorySize();
			long free = osBean.getFreeMemorySize();
			if (total <= 0 || free < 0)
				throw new TelemetryUnavailableException("Invalid physical memory reported: total=" + total + ", free=" + free);
			
			var memoryBean = ManagementFactory.getMemoryMXBean();
			long heapUsed = memoryBean.getHeapMemoryUsage().getUsed();
			long nonHeapUsed = memoryBean.getNonHeapMemoryUsage().getUsed();
			long heapMax = Runtime.getRuntime().maxMemory();
			long virtual = osBean.getCommittedVirtualMemorySize();
			
			return new MemorySample(
					GeneralTools.bytesToMB(heapUsed + nonHeapUsed),
					virtual < 0 ? Double.NaN : GeneralTools.bytesToMB(virtual),
					GeneralTools.bytesToMB(heapUsed),
					heapMax == Long.MAX_VALUE ? Double.POSITIVE_INFINITY : GeneralTools.bytesToMB(heapMax),
					GeneralTools.bytesToMB(total - free),
					GeneralTools.bytesToMB(total)
					);
		}
		
	}

}
