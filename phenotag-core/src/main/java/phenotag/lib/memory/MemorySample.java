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

import java.util.Locale;

/**
 * A single reading of process and system memory usage.
 * <p>
 * All sizes are in MiB.
 * 
 * @author PhenoTag developers
 */
public class MemorySample {
	
	private final double processUsedMB;
	private final double processVirtualMB;
	private final double heapUsedMB;
	private final double heapMaxMB;
	private final double systemUsedMB;
	private final double systemTotalMB;
	
	/**
	 * Constructor.
	 * @param processUsedMB memory used by this process (JVM heap and non-heap)
	 * @param processVirtualMB virtual memory committed to this process
	 * @param heapUsedMB heap memory currently used
	 * @param heapMaxMB maximum heap size, or {@link Double#POSITIVE_INFINITY} if unbounded
	 * @param systemUsedMB physical memory used across the system
	 * @param systemTotalMB total physical memory of the system
	 */
	public MemorySample(double processUsedMB, double processVirtualMB, double heapUsedMB, double heapMaxMB,
			double systemUsedMB, double systemTotalMB) {
		this.processUsedMB = processUsedMB;
		this.processVirtualMB = processVirtualMB;
		this.heapUsedMB = heapUsedMB;
		this.heapMaxMB = heapMaxMB;
		this.systemUsedMB = systemUsedMB;
		this.systemTotalMB = systemTotalMB;
	}

	/**
	 * @return memory used by this process
	 */
	public double getProcessUsedMB() {
		return processUsedMB;
	}

	/**
	 * @return virtual memory committed to this process
	 */
	public double getProcessVirtualMB() {
		return processVirtualMB;
	}
	
	/**
	 * @return heap memory currently used
	 */
	public double getHeapUsedMB() {
		return heapUsedMB;
	}

	/**
	 * @return maximum heap size
	 */
	public double getHeapMaxMB() {
		return heapMaxMB;
	}

	/**
	 * @return physical memory in use across the system
	 */
	public double getSystemUsedMB() {
		return systemUsedMB;
	}

	/**
	 * @return total physical memory
	 */
	public double getSystemTotalMB() {
		return systemTotalMB;
	}

	/**
	 * @return percentage of physical memory in use, 0-100
	 */
	public double getSystemUsedPct() {
		return systemTotalMB <= 0 ? 0 : systemUsedMB / systemTotalMB * 100.0;
	}
	
	/**
	 * Memory that can still be used for new image buffers.
	 * <p>
	 * This is the smaller of the free physical memory and the remaining heap, 
	 * because pixel buffers live on the heap.
	 * 
	 * @return available memory in MiB, never negative
	 */
	public double availableMB() {
		double systemFree = systemTotalMB - systemUsedMB;
		double heapFree = heapMaxMB - heapUsedMB;
		return Math.max(0, Math.min(systemFree, heapFree));
	}
	
	@Override
	public String toString() {
		return String.format(Locale.ROOT, "Process: %.1fMB (virtual %.1fMB), Heap: %.1f/%.1fMB, System: %.1f%% of %.1fMB",
				processUsedMB, processVirtualMB, heapUsedMB, heapMaxMB, getSystemUsedPct(), systemTotalMB);
	}

}
