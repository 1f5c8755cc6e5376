package com.namekis.gitfleet.git;

import com.namekis.gitfleet.domain.PushAccess;

/** Push access observed with a dry run push, together with the remote that was probed. */
public record PushAccessProbe(PushAccess access, String remote) {
}
