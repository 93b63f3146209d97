/*
 * BSD 2-Clause License
 *
 * Copyright (c) 2022, Vladimír Ulman
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *
 * 1. Redistributions of source code must retain the above copyright notice, this
 *    list of conditions and the following disclaimer.
 *
 * 2. Redistributions in binary form must reproduce the above copyright notice,
 *    this list of conditions and the following disclaimer in the documentation
 *    and/or other materials provided with the distribution.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE LIABLE
 * FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL
 * DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR
 * SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER
 * CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY,
 * OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */
package de.mpicbg.ulman.ensemble.download;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What, and from where, to download: the archive URLs, the forecast
 * categories (local folder name and the variable code used in the archive),
 * the ensemble runs, and how many lead and history months to consider.
 */
public class AcquisitionConfig
{
	public static final String CFS_BASE_URL = "https://www.cpc.ncep.noaa.gov/products/CFSv2/";
	public static final String CFS_HISTORY_URL = "https://www.cpc.ncep.noaa.gov/products/CFSv2/cfsv2_fcst_history/";

	public final String baseUrl;
	public final String historyUrl;
	/** local folder name -> archive variable code, iterated in insertion order */
	public final Map<String,String> categories;
	public final List<String> ensembleRuns;
	public final int leadMonths;
	public final int historyMonths;

	public AcquisitionConfig(final String baseUrl,
	                         final String historyUrl,
	                         final Map<String,String> categories,
	                         final List<String> ensembleRuns,
	                         final int leadMonths,
	                         final int historyMonths)
	{
		this.baseUrl = baseUrl;
		this.historyUrl = historyUrl;
		this.categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories));
		this.ensembleRuns = Collections.unmodifiableList(new ArrayList<>(ensembleRuns));
		this.leadMonths = leadMonths;
		this.historyMonths = historyMonths;
	}

	/** European 2m temperature and precipitation of the three CFSv2 runs */
	static public AcquisitionConfig defaults()
	{
		return builder().build();
	}

	// ============= building =============
	static public Builder builder() { return new Builder(); }

	static public class Builder
	{
		private String baseUrl = CFS_BASE_URL;
		private String historyUrl = CFS_HISTORY_URL;
		private final Map<String,String> categories = new LinkedHashMap<>();
		private final List<String> ensembleRuns = new ArrayList<>();
		private int leadMonths = 6;
		private int historyMonths = 6;

		public Builder setBaseUrl(final String baseUrl) {
			this.baseUrl = baseUrl;
			return this;
		}
		public Builder setHistoryUrl(final String historyUrl) {
			this.historyUrl = historyUrl;
			return this;
		}
		public Builder addCategory(final String folderName, final String variableCode) {
			categories.put(folderName, variableCode);
			return this;
		}
		public Builder addEnsembleRun(final String run) {
			ensembleRuns.add(run);
			return this;
		}
		public Builder setLeadMonths(final int leadMonths) {
			this.leadMonths = leadMonths;
			return this;
		}
		public Builder setHistoryMonths(final int historyMonths) {
			this.historyMonths = historyMonths;
			return this;
		}

		public AcquisitionConfig build() {
			if (categories.isEmpty()) {
				categories.put("Europe_T2m", "euT2m");
				categories.put("Europe_Prec", "euPrec");
			}
			if (ensembleRuns.isEmpty()) {
				ensembleRuns.add("1");
				ensembleRuns.add("2");
				ensembleRuns.add("3");
			}
			if (baseUrl == null || historyUrl == null)
				throw new IllegalArgumentException("Both archive URLs must be provided.");
			if (leadMonths < 1)
				throw new IllegalArgumentException("At least one lead month must be requested.");
			if (historyMonths < 0)
				throw new IllegalArgumentException("Number of history months must be non-negative.");

			return new AcquisitionConfig(baseUrl,historyUrl,categories,ensembleRuns,leadMonths,historyMonths);
		}
	}
}
