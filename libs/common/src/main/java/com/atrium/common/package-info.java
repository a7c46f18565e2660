/**
 * Failure taxonomy shared by the security, tenancy and service modules.
 *
 * @see com.atrium.common.AtriumException
 */
package com.atrium.common;
