package com.slack.dispatch.dispatcher;

import com.slack.dispatch.cluster.DispatchTarget;
import com.slack.dispatch.proto.service.SearchDispatchServiceGrpc;

/** Supplies the async stub used to call a dispatch target. */
public interface StubProvider {

  SearchDispatchServiceGrpc.SearchDispatchServiceStub stubFor(DispatchTarget target);
}
