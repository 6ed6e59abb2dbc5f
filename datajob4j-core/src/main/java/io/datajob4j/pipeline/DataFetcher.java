package io.datajob4j.pipeline;

import io.datajob4j.core.DataSource;
import io.datajob4j.core.Dataset;
import io.datajob4j.core.FetchException;

public interface DataFetcher {

    Dataset fetch(DataSource source) throws FetchException;
}
