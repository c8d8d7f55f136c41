// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream.cli;

enum CommandType {
    /** Write each delimited record, followed by the output separator. */ SPLIT,
    /** Write the number of records and bytes in each input. */          COUNT
}
