package com.rolebridge.service.sync;

import com.rolebridge.identity.ApplicationGroup;
import com.rolebridge.identity.ApplicationUser;

import java.util.List;

/**
 * Read access to the application's identity store, used by the periodic reconciliation pass.
 *
 * <p>The host application provides the bean. Without one, reconciliation is skipped and only
 * event-driven synchronization runs.
 */
public interface IdentityDirectory {

    /** Every user that currently exists, active or not. */
    List<ApplicationUser> users();

    /** Every group that currently exists, with its full member list. */
    List<ApplicationGroup> groups();
}
