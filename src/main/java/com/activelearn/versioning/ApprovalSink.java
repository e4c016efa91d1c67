package com.activelearn.versioning;

import java.io.IOException;

import com.activelearn.pipeline.BundleDiff;

public interface ApprovalSink {

    String create(String agent, String bundleId, BundleDiff diff, String proposer) throws IOException;
}
